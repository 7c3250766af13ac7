package com.purchasingpower.codelod.cli.commands;

import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.cli.ExitCodes;
import com.purchasingpower.codelod.cli.LodCommand;
import com.purchasingpower.codelod.core.CodeLodPaths;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Removes a hook installed by {@code install-hook}. Hooks written by anything else are left alone.
 */
@Component
@RequiredArgsConstructor
public class UninstallHookCommand implements LodCommand {

    private final CodeLodPaths paths;
    private final CommandOutput output;

    @Override
    public String getName() {
        return "uninstall-hook";
    }

    @Override
    public String getDescription() {
        return "Remove the code-lod git hook";
    }

    @Override
    public String getUsage() {
        return "[--hook-type=pre-commit|pre-push]";
    }

    @Override
    public Set<String> getOptions() {
        return Set.of("hook-type");
    }

    @Override
    public int execute(CommandArguments args) {
        String hookType = GitHooks.hookType(args);
        Optional<Path> hook = GitHooks.hooksDir(paths).map(dir -> dir.resolve(hookType));
        try {
            if (hook.isEmpty() || !Files.exists(hook.get())
                || !Files.readString(hook.get(), StandardCharsets.UTF_8).contains(GitHooks.MARKER)) {
                output.println("No hook found");
                return ExitCodes.OK;
            }
            Files.delete(hook.get());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove " + hook.get(), e);
        }
        output.println("Uninstalled " + hookType + " hook");
        return ExitCodes.OK;
    }
}
