package com.purchasingpower.codelod.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.cli.ExitCodes;
import com.purchasingpower.codelod.cli.LodCommand;
import com.purchasingpower.codelod.cli.ProjectScanner;
import com.purchasingpower.codelod.cli.UsageException;
import com.purchasingpower.codelod.core.Freshness;
import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.core.Scope;
import com.purchasingpower.codelod.staleness.StalenessTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Prints the stored descriptions of the entities under a path.
 */
@Component
@RequiredArgsConstructor
public class ReadCommand implements LodCommand {

    private final ProjectScanner scanner;
    private final StalenessTracker tracker;
    private final ObjectMapper objectMapper;
    private final CommandOutput output;

    @Override
    public String getName() {
        return "read";
    }

    @Override
    public String getDescription() {
        return "Print descriptions";
    }

    @Override
    public String getUsage() {
        return "[path] [--scope=module|class|function] [--format=text|json]";
    }

    @Override
    public Set<String> getOptions() {
        return Set.of("scope", "format");
    }

    @Override
    public int execute(CommandArguments args) {
        String format = args.option("format").orElse("text").toLowerCase(Locale.ROOT);
        if (!format.equals("text") && !format.equals("json")) {
            throw new UsageException("Unknown format: " + format);
        }
        Scope scope = scanner.scope(args).orElse(null);
        List<ParsedEntity> entities = scanner.entities(scanner.sources(scanner.target(args)), scope);

        List<Map<String, Object>> rows = new ArrayList<>();
        for (ParsedEntity entity : entities) {
            Freshness freshness = tracker.check(entity.identity(), entity.getFingerprint());
            String description = tracker.resolveDescription(entity.identity(), entity.getFingerprint()).orElse(null);

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("scope", entity.getScope().value());
            row.put("name", entity.getName());
            row.put("path", entity.getLocation().path());
            row.put("startLine", entity.getLocation().startLine());
            row.put("endLine", entity.getLocation().endLine());
            row.put("hash", entity.getFingerprint());
            row.put("freshness", freshness.name().toLowerCase(Locale.ROOT));
            row.put("description", description);
            rows.add(row);
        }

        if (format.equals("json")) {
            try {
                output.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(rows));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot render descriptions as JSON", e);
            }
            return ExitCodes.OK;
        }

        for (Map<String, Object> row : rows) {
            output.printf("[%s] %s%n", row.get("scope"), row.get("name"));
            Object description = row.get("description");
            output.println("  " + (description == null ? "(no description)" : description));
            output.println("");
        }
        return ExitCodes.OK;
    }
}
