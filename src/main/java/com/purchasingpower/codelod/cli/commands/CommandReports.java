package com.purchasingpower.codelod.cli.commands;

import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.cli.ExitCodes;
import com.purchasingpower.codelod.pipeline.GenerationReport;
import com.purchasingpower.codelod.staleness.FreshnessReport;
import com.purchasingpower.codelod.staleness.StaleEntry;

/**
 * Console rendering shared by several commands.
 */
final class CommandReports {

    private CommandReports() {
    }

    static int printGeneration(GenerationReport report, CommandOutput output) {
        output.printf("Scanned %d files, %d entities%n", report.getFilesScanned(), report.getEntitiesDiscovered());
        output.printf("  Generated: %d | Reused: %d | Up to date: %d | Failed: %d%n",
            report.getGenerated(), report.getReused(), report.getAlreadyFresh(), report.getFailed());
        output.printf("  Sidecars written: %d%n", report.getSidecarsWritten());
        for (String error : report.getErrors()) {
            output.error("  " + error);
        }
        if (report.isInterrupted()) {
            output.error("Interrupted: descriptions generated so far were kept.");
        }
        return report.isSuccess() ? ExitCodes.OK : ExitCodes.FAILURE;
    }

    static void printEntry(StaleEntry entry, CommandOutput output) {
        String label = entry.isUnknown() ? "NEW" : "STALE";
        output.printf("  [%s] %s: %s (%s)%n", label, entry.getScope().value(), entry.getName(), entry.getPath());
    }

    static void printSummary(FreshnessReport report, CommandOutput output) {
        output.printf("%nTotal: %d | Fresh: %d | Stale: %d%n", report.getTotal(), report.getFresh(), report.getStale());
    }
}
