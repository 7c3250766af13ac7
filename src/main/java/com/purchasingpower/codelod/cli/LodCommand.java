package com.purchasingpower.codelod.cli;

import java.util.Set;

/**
 * A command of the code-lod command line.
 *
 * <p>Commands are Spring beans collected by {@link CommandDispatcher}. Example:
 * <pre>
 * &#64;Component
 * public class RecoverCommand implements LodCommand {
 *     public String getName() { return "recover"; }
 *
 *     public String getDescription() { return "Rebuild the hash index from sidecar files"; }
 *
 *     public int execute(CommandArguments args) {
 *         // run and return an exit code
 *     }
 * }
 * </pre>
 *
 * @since 0.1.0
 */
public interface LodCommand {

    /**
     * Name typed on the command line, e.g. "status".
     */
    String getName();

    /**
     * One-line summary for the help listing.
     */
    String getDescription();

    /**
     * Argument synopsis, e.g. "[path] [--stale-only]".
     */
    default String getUsage() {
        return "";
    }

    /**
     * Long option names accepted by the command. Anything else is a usage error.
     */
    default Set<String> getOptions() {
        return Set.of();
    }

    /**
     * Short flags accepted by the command, e.g. 'y' for -y.
     */
    default Set<Character> getShortFlags() {
        return Set.of();
    }

    /**
     * Whether the command needs an initialized project.
     */
    default boolean requiresProject() {
        return true;
    }

    /**
     * @return process exit code, see {@link ExitCodes}
     * @throws UsageException on invalid arguments
     */
    int execute(CommandArguments args);
}
