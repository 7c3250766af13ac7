package com.purchasingpower.codelod.cli.commands;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.cli.ExitCodes;
import com.purchasingpower.codelod.cli.LodCommand;
import com.purchasingpower.codelod.cli.UsageException;
import com.purchasingpower.codelod.configuration.CodeLodProperties;
import com.purchasingpower.codelod.core.CodeLodPaths;
import com.purchasingpower.codelod.exception.SidecarException;
import com.purchasingpower.codelod.generator.Provider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Creates {@code .code-lod/} with its sidecar directory and a project config file.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InitCommand implements LodCommand {

    private final CodeLodPaths paths;
    private final CodeLodProperties properties;
    private final YAMLMapper yamlMapper;
    private final CommandOutput output;

    @Override
    public String getName() {
        return "init";
    }

    @Override
    public String getDescription() {
        return "Initialize code-lod in the current directory";
    }

    @Override
    public String getUsage() {
        return "[--provider=mock|ollama|openai|anthropic] [--language=java] [--max-parallelism=N] [--force]";
    }

    @Override
    public Set<String> getOptions() {
        return Set.of("provider", "language", "max-parallelism", "force");
    }

    @Override
    public boolean requiresProject() {
        return false;
    }

    @Override
    public int execute(CommandArguments args) {
        boolean force = args.hasOption("force");
        if (Files.exists(paths.configFile()) && !force) {
            output.error("code-lod is already initialized in " + paths.rootDir() + ". Use --force to re-initialize.");
            return ExitCodes.FAILURE;
        }
        if (force && Files.exists(paths.configFile())) {
            output.println("Re-initializing code-lod...");
        }

        Provider provider = args.option("provider").map(this::provider).orElse(properties.getProvider());
        List<String> languages = args.option("language")
            .map(l -> Arrays.stream(l.split(",")).map(String::strip).filter(s -> !s.isEmpty()).toList())
            .orElse(properties.getLanguages());
        int maxParallelism = args.option("max-parallelism").map(this::parallelism).orElse(properties.getMaxParallelism());

        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("provider", provider.value());
        settings.put("languages", languages);
        settings.put("max-parallelism", maxParallelism);
        settings.put("history-limit", properties.getHistoryLimit());
        settings.put("fail-on-stale", properties.isFailOnStale());
        settings.put("auto-update", properties.isAutoUpdate());

        try {
            Files.createDirectories(paths.lodDir());
            yamlMapper.writeValue(paths.configFile().toFile(), Map.of("codelod", settings));
        } catch (IOException e) {
            throw new SidecarException(paths.codeLodDir(), "Failed to initialize", e);
        }

        log.info("✅ Initialized code-lod in {}", paths.rootDir());
        output.println("Initialized code-lod in " + paths.rootDir());
        output.println("  Config: " + paths.configFile());
        output.println("  LOD directory: " + paths.lodDir());
        return ExitCodes.OK;
    }

    private Provider provider(String value) {
        try {
            return Provider.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private int parallelism(String value) {
        try {
            int parsed = Integer.parseInt(value.strip());
            if (parsed < 1 || parsed > 64) {
                throw new UsageException("--max-parallelism must be between 1 and 64");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new UsageException("--max-parallelism must be a number: " + value);
        }
    }
}
