package com.purchasingpower.codelod.cli.commands;

import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.cli.ExitCodes;
import com.purchasingpower.codelod.cli.LodCommand;
import com.purchasingpower.codelod.cli.ProjectScanner;
import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.staleness.FreshnessReport;
import com.purchasingpower.codelod.staleness.StaleEntry;
import com.purchasingpower.codelod.staleness.StalenessTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Freshness of every entity under a path. Exits 1 when anything needs generation.
 */
@Component
@RequiredArgsConstructor
public class StatusCommand implements LodCommand {

    private final ProjectScanner scanner;
    private final StalenessTracker tracker;
    private final CommandOutput output;

    @Override
    public String getName() {
        return "status";
    }

    @Override
    public String getDescription() {
        return "Show freshness of descriptions";
    }

    @Override
    public String getUsage() {
        return "[path] [--stale-only]";
    }

    @Override
    public Set<String> getOptions() {
        return Set.of("stale-only");
    }

    @Override
    public int execute(CommandArguments args) {
        List<ParsedEntity> entities = scanner.entities(scanner.sources(scanner.target(args)), null);
        FreshnessReport report = tracker.checkBatch(entities);

        boolean staleOnly = args.hasOption("stale-only");
        for (StaleEntry entry : report.getEntries()) {
            if (!staleOnly || !entry.isUnknown()) {
                CommandReports.printEntry(entry, output);
            }
        }
        CommandReports.printSummary(report, output);
        return report.hasStale() ? ExitCodes.FAILURE : ExitCodes.OK;
    }
}
