package com.purchasingpower.codelod.parser;

import com.purchasingpower.codelod.core.ParsedEntity;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns one source file into fingerprinted entities.
 *
 * <p>Implementations are Spring beans; {@link ParserRegistry} collects them and picks
 * one per file. A file that cannot be parsed yields an empty list, never an exception.
 *
 * @since 0.1.0
 */
public interface CodeParser {

    /**
     * Language tag, e.g. "java". Matches the values of {@code codelod.languages}.
     */
    String language();

    boolean supports(Path file);

    /**
     * Entities in source order: the module first, then each type followed by its members.
     */
    List<ParsedEntity> parseFile(Path file);
}
