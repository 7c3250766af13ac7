package com.purchasingpower.codelod.cli;

/**
 * Process exit codes of the command line.
 */
public final class ExitCodes {

    public static final int OK = 0;

    /** Command failed, or found stale descriptions where that counts as failure. */
    public static final int FAILURE = 1;

    /** Unknown command or bad option. */
    public static final int USAGE = 2;

    private ExitCodes() {
    }
}
