package com.purchasingpower.codelod.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * I/O failure on a sidecar file. Malformed fragments inside a readable file are not reported this way.
 */
@Getter
public class SidecarException extends RuntimeException {

    private final Path sidecarFile;

    public SidecarException(Path sidecarFile, String message, Throwable cause) {
        super(message + ": " + sidecarFile, cause);
        this.sidecarFile = sidecarFile;
    }
}
