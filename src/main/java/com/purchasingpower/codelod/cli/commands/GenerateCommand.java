package com.purchasingpower.codelod.cli.commands;

import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.cli.ExitCodes;
import com.purchasingpower.codelod.cli.LodCommand;
import com.purchasingpower.codelod.cli.ProjectScanner;
import com.purchasingpower.codelod.generator.DescriptionGeneratorFactory;
import com.purchasingpower.codelod.pipeline.DescriptionPipeline;
import com.purchasingpower.codelod.pipeline.GenerationReport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class GenerateCommand implements LodCommand {

    private final ProjectScanner scanner;
    private final DescriptionPipeline pipeline;
    private final DescriptionGeneratorFactory generatorFactory;
    private final CommandOutput output;

    @Override
    public String getName() {
        return "generate";
    }

    @Override
    public String getDescription() {
        return "Generate descriptions for new and changed code";
    }

    @Override
    public String getUsage() {
        return "[path] [--scope=module|class|function] [--force]";
    }

    @Override
    public Set<String> getOptions() {
        return Set.of("scope", "force");
    }

    @Override
    public int execute(CommandArguments args) {
        Path target = scanner.target(args);
        List<Path> sources = scanner.sources(target);
        if (sources.isEmpty()) {
            output.println("No supported source files under " + target);
            return ExitCodes.OK;
        }

        GenerationReport report = pipeline.generate(sources, args.hasOption("force"),
            scanner.scope(args).orElse(null), generatorFactory.create());

        return CommandReports.printGeneration(report, output);
    }
}
