package com.purchasingpower.codelod.exception;

import lombok.Getter;

@Getter
public class DescriptionGenerationException extends RuntimeException {

    private final String entityName;

    public DescriptionGenerationException(String entityName, String message, Throwable cause) {
        super(message, cause);
        this.entityName = entityName;
    }
}
