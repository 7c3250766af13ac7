package com.purchasingpower.codelod.cli.commands;

import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.cli.UsageException;
import com.purchasingpower.codelod.core.CodeLodPaths;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Location and content of the git hooks code-lod installs.
 */
final class GitHooks {

    static final Set<String> HOOK_TYPES = Set.of("pre-commit", "pre-push");
    static final String DEFAULT_HOOK_TYPE = "pre-commit";
    static final String MARKER = "# code-lod ";

    private GitHooks() {
    }

    static String hookType(CommandArguments args) {
        String type = args.option("hook-type").orElse(DEFAULT_HOOK_TYPE);
        if (!HOOK_TYPES.contains(type)) {
            throw new UsageException("Unsupported hook type: " + type + " (expected pre-commit or pre-push)");
        }
        return type;
    }

    static Optional<Path> hooksDir(CodeLodPaths paths) {
        Path git = paths.rootDir().resolve(".git");
        return git.toFile().isDirectory() ? Optional.of(git.resolve("hooks")) : Optional.empty();
    }

    static String script(String hookType) {
        return "#!/bin/sh\n" + MARKER + hookType + " hook\ncode-lod validate --fail-on-stale\n";
    }
}
