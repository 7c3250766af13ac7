package com.purchasingpower.codelod.cli.commands;

import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.cli.ExitCodes;
import com.purchasingpower.codelod.cli.LodCommand;
import com.purchasingpower.codelod.sidecar.RecoveryReport;
import com.purchasingpower.codelod.sidecar.SidecarSynchronizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Rebuilds a lost hash index from the sidecar files. History is not recovered.
 */
@Component
@RequiredArgsConstructor
public class RecoverCommand implements LodCommand {

    private final SidecarSynchronizer sidecars;
    private final CommandOutput output;

    @Override
    public String getName() {
        return "recover";
    }

    @Override
    public String getDescription() {
        return "Rebuild the hash index from sidecar files";
    }

    @Override
    public int execute(CommandArguments args) {
        RecoveryReport report = sidecars.seedIndex();
        output.printf("Read %d sidecar files (%d descriptions)%n", report.getSidecarsRead(), report.getFragmentsRead());
        output.printf("  Restored: %d | Already present: %d | Entities linked: %d%n",
            report.getRecordsSeeded(), report.getRecordsAlreadyPresent(), report.getIdentitiesPointed());
        return ExitCodes.OK;
    }
}
