package com.purchasingpower.codelod.cli.commands;

import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.cli.ExitCodes;
import com.purchasingpower.codelod.cli.LodCommand;
import com.purchasingpower.codelod.cli.UsageException;
import com.purchasingpower.codelod.fingerprint.Fingerprints;
import com.purchasingpower.codelod.staleness.StalenessTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class InvalidateCommand implements LodCommand {

    private final StalenessTracker tracker;
    private final CommandOutput output;

    @Override
    public String getName() {
        return "invalidate";
    }

    @Override
    public String getDescription() {
        return "Mark descriptions stale so they are regenerated";
    }

    @Override
    public String getUsage() {
        return "<sha256:...> [<sha256:...>...]";
    }

    @Override
    public int execute(CommandArguments args) {
        if (args.positionals().isEmpty()) {
            throw new UsageException("At least one fingerprint is required");
        }
        for (String fingerprint : args.positionals()) {
            if (!Fingerprints.isValid(fingerprint)) {
                throw new UsageException("Not a fingerprint: " + fingerprint);
            }
        }

        int invalidated = 0;
        for (String fingerprint : args.positionals()) {
            if (tracker.invalidate(fingerprint)) {
                invalidated++;
                output.println("Invalidated " + fingerprint);
            } else {
                output.error("No description for " + fingerprint);
            }
        }
        return invalidated == args.positionals().size() ? ExitCodes.OK : ExitCodes.FAILURE;
    }
}
