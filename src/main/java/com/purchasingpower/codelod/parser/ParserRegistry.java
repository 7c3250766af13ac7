package com.purchasingpower.codelod.parser;

import com.purchasingpower.codelod.configuration.CodeLodProperties;
import com.purchasingpower.codelod.core.CodeLodPaths;
import com.purchasingpower.codelod.core.ParsedEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Registry of the available parsers, restricted to the configured languages.
 */
@Slf4j
@Component
public class ParserRegistry {

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of(
        CodeLodPaths.CODE_LOD_DIR, ".git", ".idea", "target", "build", "node_modules", "__pycache__");

    private final List<CodeParser> parsers;

    public ParserRegistry(List<CodeParser> parsers, CodeLodProperties properties) {
        Set<String> enabled = properties.getLanguages().stream()
            .map(l -> l.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        this.parsers = parsers.stream()
            .filter(p -> enabled.contains(p.language()))
            .toList();
        log.debug("Parsers enabled: {}", this.parsers.stream().map(CodeParser::language).toList());
    }

    public Optional<CodeParser> forFile(Path file) {
        return parsers.stream().filter(p -> p.supports(file)).findFirst();
    }

    public boolean supports(Path file) {
        return forFile(file).isPresent();
    }

    public List<ParsedEntity> parse(Path file) {
        return forFile(file).map(p -> p.parseFile(file)).orElse(List.of());
    }

    /**
     * Supported source files under {@code start} (a file or a directory), sorted by path.
     * Build output, VCS metadata and code-lod's own directory are skipped.
     */
    public List<Path> collectSources(Path start) {
        if (Files.isRegularFile(start)) {
            return supports(start) ? List.of(start.toAbsolutePath().normalize()) : List.of();
        }
        if (!Files.isDirectory(start)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(start)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(p -> !isInSkippedDirectory(start, p))
                .filter(this::supports)
                .map(p -> p.toAbsolutePath().normalize())
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + start, e);
        }
    }

    private boolean isInSkippedDirectory(Path start, Path file) {
        Path relative = start.relativize(file);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (SKIPPED_DIRECTORIES.contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }
}
