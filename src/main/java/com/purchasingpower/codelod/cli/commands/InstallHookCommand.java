package com.purchasingpower.codelod.cli.commands;

import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.cli.ExitCodes;
import com.purchasingpower.codelod.cli.LodCommand;
import com.purchasingpower.codelod.core.CodeLodPaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;

/**
 * Installs a git hook that runs {@code code-lod validate --fail-on-stale}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InstallHookCommand implements LodCommand {

    private final CodeLodPaths paths;
    private final CommandOutput output;

    @Override
    public String getName() {
        return "install-hook";
    }

    @Override
    public String getDescription() {
        return "Install a git hook that validates descriptions";
    }

    @Override
    public String getUsage() {
        return "[--hook-type=pre-commit|pre-push] [--force]";
    }

    @Override
    public Set<String> getOptions() {
        return Set.of("hook-type", "force");
    }

    @Override
    public int execute(CommandArguments args) {
        String hookType = GitHooks.hookType(args);
        Optional<Path> hooksDir = GitHooks.hooksDir(paths);
        if (hooksDir.isEmpty()) {
            output.error("Not a git repository");
            return ExitCodes.FAILURE;
        }

        Path hook = hooksDir.get().resolve(hookType);
        try {
            if (Files.exists(hook) && !args.hasOption("force")
                && !Files.readString(hook, StandardCharsets.UTF_8).contains(GitHooks.MARKER)) {
                output.error("A " + hookType + " hook already exists. Use --force to replace it.");
                return ExitCodes.FAILURE;
            }
            Files.createDirectories(hook.getParent());
            Files.writeString(hook, GitHooks.script(hookType), StandardCharsets.UTF_8);
            makeExecutable(hook);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to install " + hook, e);
        }

        log.info("🪝 Installed {} hook at {}", hookType, hook);
        output.println("Installed " + hookType + " hook");
        return ExitCodes.OK;
    }

    private void makeExecutable(Path hook) throws IOException {
        try {
            Files.setPosixFilePermissions(hook, PosixFilePermissions.fromString("rwxr-xr-x"));
        } catch (UnsupportedOperationException e) {
            if (!hook.toFile().setExecutable(true, false)) {
                log.warn("⚠️ Could not mark {} executable", hook);
            }
        }
    }
}
