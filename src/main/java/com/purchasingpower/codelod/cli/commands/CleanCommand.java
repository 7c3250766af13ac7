package com.purchasingpower.codelod.cli.commands;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.cli.ExitCodes;
import com.purchasingpower.codelod.cli.LodCommand;
import com.purchasingpower.codelod.core.CodeLodPaths;
import com.purchasingpower.codelod.exception.SidecarException;
import com.purchasingpower.codelod.index.HashIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Set;

/**
 * Whole-store reset: empties the hash index and deletes every sidecar. Config is kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CleanCommand implements LodCommand {

    private final HashIndex index;
    private final CodeLodPaths paths;
    private final CommandOutput output;

    @Override
    public String getName() {
        return "clean";
    }

    @Override
    public String getDescription() {
        return "Delete all descriptions and sidecar files";
    }

    @Override
    public String getUsage() {
        return "--force";
    }

    @Override
    public Set<String> getOptions() {
        return Set.of("force");
    }

    @Override
    public int execute(CommandArguments args) {
        if (!args.hasOption("force")) {
            output.error("This deletes every stored description. Re-run with --force to confirm.");
            return ExitCodes.FAILURE;
        }

        long records = index.count();
        index.clear();
        try {
            if (Files.exists(paths.lodDir())) {
                MoreFiles.deleteRecursively(paths.lodDir(), RecursiveDeleteOption.ALLOW_INSECURE);
            }
            Files.createDirectories(paths.lodDir());
        } catch (IOException e) {
            throw new SidecarException(paths.lodDir(), "Failed to delete sidecars", e);
        }

        log.info("🗑️ Cleaned {} records and all sidecars", records);
        output.println("Cleaned code-lod data (" + records + " descriptions removed)");
        return ExitCodes.OK;
    }
}
