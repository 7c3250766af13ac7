package com.purchasingpower.codelod.cli;

/**
 * Invalid command line. Reported with exit code {@link ExitCodes#USAGE}.
 */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }
}
