package com.purchasingpower.codelod.cli;

import java.io.PrintStream;

/**
 * Where commands print. Kept separate from logging, which goes to the log file.
 */
public class CommandOutput {

    private final PrintStream out;
    private final PrintStream err;

    public CommandOutput(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public void println(String line) {
        out.println(line);
    }

    public void printf(String format, Object... args) {
        out.printf(format, args);
    }

    public void error(String line) {
        err.println(line);
    }

    public void flush() {
        out.flush();
        err.flush();
    }
}
