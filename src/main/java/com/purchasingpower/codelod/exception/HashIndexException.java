package com.purchasingpower.codelod.exception;

import lombok.Getter;

/**
 * Storage failure while reading or writing the hash index. Nothing partial is
 * committed; {@link #isRetryable()} tells whether the same call may succeed later.
 */
@Getter
public class HashIndexException extends RuntimeException {

    private final boolean retryable;

    public HashIndexException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }
}
