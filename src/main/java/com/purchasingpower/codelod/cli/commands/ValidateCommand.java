package com.purchasingpower.codelod.cli.commands;

import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.cli.ExitCodes;
import com.purchasingpower.codelod.cli.LodCommand;
import com.purchasingpower.codelod.cli.ProjectScanner;
import com.purchasingpower.codelod.configuration.CodeLodProperties;
import com.purchasingpower.codelod.index.DescriptionRecord;
import com.purchasingpower.codelod.staleness.FreshnessReport;
import com.purchasingpower.codelod.staleness.StalenessTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Check meant for git hooks and CI. Only fails with --fail-on-stale or {@code codelod.fail-on-stale}.
 */
@Component
@RequiredArgsConstructor
public class ValidateCommand implements LodCommand {

    private final ProjectScanner scanner;
    private final StalenessTracker tracker;
    private final CodeLodProperties properties;
    private final CommandOutput output;

    @Override
    public String getName() {
        return "validate";
    }

    @Override
    public String getDescription() {
        return "Validate that descriptions are fresh";
    }

    @Override
    public String getUsage() {
        return "[path] [--fail-on-stale]";
    }

    @Override
    public Set<String> getOptions() {
        return Set.of("fail-on-stale");
    }

    @Override
    public int execute(CommandArguments args) {
        List<DescriptionRecord> flagged = tracker.listStale();
        FreshnessReport report = tracker.checkBatch(scanner.entities(scanner.sources(scanner.target(args)), null));

        if (!flagged.isEmpty()) {
            output.println("Found " + flagged.size() + " stale descriptions");
        }
        if (!report.hasStale()) {
            output.println("All descriptions are fresh");
            return ExitCodes.OK;
        }

        report.getEntries().forEach(entry -> CommandReports.printEntry(entry, output));
        CommandReports.printSummary(report, output);

        boolean failOnStale = args.hasOption("fail-on-stale") || properties.isFailOnStale();
        return failOnStale ? ExitCodes.FAILURE : ExitCodes.OK;
    }
}
