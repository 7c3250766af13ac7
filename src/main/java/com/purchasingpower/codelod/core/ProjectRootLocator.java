package com.purchasingpower.codelod.core;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Finds the project root: the nearest ancestor holding a {@code .code-lod} directory.
 */
public final class ProjectRootLocator {

    private ProjectRootLocator() {
    }

    public static Optional<Path> locate(Path start) {
        Path path = start.toAbsolutePath().normalize();
        while (path != null) {
            if (Files.isDirectory(path.resolve(CodeLodPaths.CODE_LOD_DIR))) {
                return Optional.of(path);
            }
            path = path.getParent();
        }
        return Optional.empty();
    }
}
