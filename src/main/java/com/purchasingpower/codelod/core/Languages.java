package com.purchasingpower.codelod.core;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * File extension to language tag table.
 */
public final class Languages {

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
        Map.entry(".py", "python"),
        Map.entry(".js", "javascript"),
        Map.entry(".jsx", "javascript"),
        Map.entry(".ts", "typescript"),
        Map.entry(".tsx", "typescript"),
        Map.entry(".go", "go"),
        Map.entry(".rs", "rust"),
        Map.entry(".c", "c"),
        Map.entry(".h", "c"),
        Map.entry(".cpp", "cpp"),
        Map.entry(".cc", "cpp"),
        Map.entry(".cxx", "cpp"),
        Map.entry(".hpp", "cpp"),
        Map.entry(".java", "java"),
        Map.entry(".kt", "kotlin"),
        Map.entry(".swift", "swift"),
        Map.entry(".rb", "ruby"),
        Map.entry(".php", "php"),
        Map.entry(".cs", "c_sharp"),
        Map.entry(".scala", "scala"),
        Map.entry(".sh", "bash"),
        Map.entry(".yaml", "yaml"),
        Map.entry(".yml", "yaml"),
        Map.entry(".toml", "toml"));

    private Languages() {
    }

    public static Optional<String> detect(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_EXTENSION.get(name.substring(dot).toLowerCase(Locale.ROOT)));
    }
}
