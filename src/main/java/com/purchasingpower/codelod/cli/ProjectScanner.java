package com.purchasingpower.codelod.cli;

import com.purchasingpower.codelod.core.CodeLodPaths;
import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.core.Scope;
import com.purchasingpower.codelod.parser.ParserRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Argument handling shared by the commands that work on source files.
 */
@Component
@RequiredArgsConstructor
public class ProjectScanner {

    private final CodeLodPaths paths;
    private final ParserRegistry parsers;

    /**
     * First positional argument, relative to the working directory, or the project root.
     */
    public Path target(CommandArguments args) {
        Path target = args.positional(0)
            .map(p -> Path.of(p).toAbsolutePath().normalize())
            .orElse(paths.rootDir());
        if (!Files.exists(target)) {
            throw new UsageException("No such file or directory: " + target);
        }
        return target;
    }

    public List<Path> sources(Path target) {
        return parsers.collectSources(target);
    }

    public List<ParsedEntity> entities(List<Path> sources, Scope scope) {
        List<ParsedEntity> entities = new ArrayList<>();
        for (Path source : sources) {
            parsers.parse(source).stream()
                .filter(e -> scope == null || e.getScope() == scope)
                .forEach(entities::add);
        }
        return entities;
    }

    public Optional<Scope> scope(CommandArguments args) {
        Optional<String> value = args.option("scope");
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Scope.fromValue(value.get()));
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    /**
     * Inverse of the project-relative paths carried by entities.
     */
    public Path resolveProjectPath(String relativePath) {
        return paths.rootDir().resolve(relativePath).normalize();
    }
}
