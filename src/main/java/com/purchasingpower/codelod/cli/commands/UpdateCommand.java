package com.purchasingpower.codelod.cli.commands;

import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.cli.ExitCodes;
import com.purchasingpower.codelod.cli.LodCommand;
import com.purchasingpower.codelod.cli.ProjectScanner;
import com.purchasingpower.codelod.generator.DescriptionGeneratorFactory;
import com.purchasingpower.codelod.pipeline.DescriptionPipeline;
import com.purchasingpower.codelod.staleness.FreshnessReport;
import com.purchasingpower.codelod.staleness.StaleEntry;
import com.purchasingpower.codelod.staleness.StalenessTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Regenerates what {@code status} reports. Asks for --yes (or -y) before calling the provider.
 */
@Component
@RequiredArgsConstructor
public class UpdateCommand implements LodCommand {

    private final ProjectScanner scanner;
    private final StalenessTracker tracker;
    private final DescriptionPipeline pipeline;
    private final DescriptionGeneratorFactory generatorFactory;
    private final CommandOutput output;

    @Override
    public String getName() {
        return "update";
    }

    @Override
    public String getDescription() {
        return "Regenerate stale descriptions";
    }

    @Override
    public String getUsage() {
        return "[path] [--yes|-y]";
    }

    @Override
    public Set<String> getOptions() {
        return Set.of("yes");
    }

    @Override
    public Set<Character> getShortFlags() {
        return Set.of('y');
    }

    @Override
    public int execute(CommandArguments args) {
        Path target = scanner.target(args);
        List<Path> sources = scanner.sources(target);
        FreshnessReport report = tracker.checkBatch(scanner.entities(sources, null));

        if (!report.hasStale()) {
            output.println("No stale descriptions to update");
            return ExitCodes.OK;
        }
        output.println("Found " + report.getStale() + " stale descriptions");
        report.getEntries().forEach(entry -> CommandReports.printEntry(entry, output));

        if (!args.hasOption("yes") && !args.hasFlag('y')) {
            output.error("Re-run with --yes to regenerate them.");
            return ExitCodes.FAILURE;
        }

        Set<Path> affected = new TreeSet<>();
        for (StaleEntry entry : report.getEntries()) {
            affected.add(scanner.resolveProjectPath(entry.getPath()));
        }
        return CommandReports.printGeneration(
            pipeline.generate(List.copyOf(affected), false, null, generatorFactory.create()), output);
    }
}
