package com.purchasingpower.codelod.core;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Standard locations of code-lod state inside a project.
 *
 * @since 0.1.0
 */
public record CodeLodPaths(Path rootDir, Path codeLodDir, Path lodDir, Path configFile, Path hashDb) {

    public static final String CODE_LOD_DIR = ".code-lod";
    public static final String SIDECAR_SUFFIX = ".lod";

    public static CodeLodPaths of(Path rootDir) {
        Path root = rootDir.toAbsolutePath().normalize();
        Path codeLod = root.resolve(CODE_LOD_DIR);
        return new CodeLodPaths(
            root,
            codeLod,
            codeLod.resolve(".lod"),
            codeLod.resolve("config.yml"),
            codeLod.resolve("hash-index"));
    }

    public boolean isInitialized() {
        return Files.isDirectory(codeLodDir);
    }

    /**
     * Path of a source file relative to the project root, always with forward slashes.
     */
    public String relativize(Path sourceFile) {
        Path absolute = sourceFile.toAbsolutePath().normalize();
        Path relative = absolute.startsWith(rootDir) ? rootDir.relativize(absolute) : absolute;
        return relative.toString().replace('\\', '/');
    }

    public Path sidecarFor(Path sourceFile) {
        return lodDir.resolve(relativize(sourceFile) + SIDECAR_SUFFIX);
    }

    /**
     * Inverse of {@link #sidecarFor(Path)}.
     */
    public Path sourceFor(Path sidecarFile) {
        String relative = lodDir.relativize(sidecarFile.toAbsolutePath().normalize()).toString();
        if (relative.endsWith(SIDECAR_SUFFIX)) {
            relative = relative.substring(0, relative.length() - SIDECAR_SUFFIX.length());
        }
        return rootDir.resolve(relative);
    }
}
