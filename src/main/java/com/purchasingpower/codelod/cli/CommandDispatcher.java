package com.purchasingpower.codelod.cli;

import com.purchasingpower.codelod.core.CodeLodPaths;
import com.purchasingpower.codelod.exception.DescriptionGenerationException;
import com.purchasingpower.codelod.exception.HashIndexException;
import com.purchasingpower.codelod.exception.ProjectNotInitializedException;
import com.purchasingpower.codelod.exception.SidecarException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the command named on the command line and keeps its exit code for the launcher.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "codelod.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CommandDispatcher implements ApplicationRunner, ExitCodeGenerator {

    static final String HELP = "help";

    private final Map<String, LodCommand> commands = new LinkedHashMap<>();
    private final CommandOutput output;
    private final CodeLodPaths paths;
    private int exitCode = ExitCodes.OK;

    public CommandDispatcher(List<LodCommand> commands, CommandOutput output, CodeLodPaths paths) {
        commands.stream()
            .sorted(Comparator.comparing(LodCommand::getName))
            .forEach(c -> this.commands.put(c.getName(), c));
        this.output = output;
        this.paths = paths;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = dispatch(CommandArguments.from(args));
        output.flush();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public int dispatch(CommandArguments args) {
        Optional<String> name = args.command();
        if (name.isEmpty() || HELP.equals(name.get()) || args.hasOption("help")) {
            printHelp();
            return name.isEmpty() && !args.hasOption("help") ? ExitCodes.USAGE : ExitCodes.OK;
        }

        LodCommand command = commands.get(name.get());
        if (command == null) {
            output.error("Unknown command: " + name.get());
            printHelp();
            return ExitCodes.USAGE;
        }

        try {
            validateOptions(command, args);
            if (command.requiresProject() && !paths.isInitialized()) {
                throw new ProjectNotInitializedException(paths.rootDir());
            }
            log.info("▶️ Running command: {}", command.getName());
            int code = command.execute(args);
            log.info("Command {} finished with exit code {}", command.getName(), code);
            return code;
        } catch (UsageException e) {
            output.error(e.getMessage());
            output.error("Usage: code-lod " + command.getName() + " " + command.getUsage());
            return ExitCodes.USAGE;
        } catch (ProjectNotInitializedException e) {
            output.error(e.getMessage());
            return ExitCodes.FAILURE;
        } catch (HashIndexException e) {
            log.error("❌ Hash index failure in {}", command.getName(), e);
            output.error("Hash index error: " + e.getMessage()
                + (e.isRetryable() ? " (the operation can be retried)" : ""));
            return ExitCodes.FAILURE;
        } catch (SidecarException | DescriptionGenerationException | IllegalStateException | UncheckedIOException e) {
            log.error("❌ Command {} failed", command.getName(), e);
            output.error("Error: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }

    private void validateOptions(LodCommand command, CommandArguments args) {
        for (String option : args.optionNames()) {
            if (!command.getOptions().contains(option)) {
                throw new UsageException("Unknown option --" + option + " for " + command.getName());
            }
        }
        for (Character flag : args.shortFlags()) {
            if (!command.getShortFlags().contains(flag)) {
                throw new UsageException("Unknown flag -" + flag + " for " + command.getName());
            }
        }
    }

    private void printHelp() {
        output.println("Usage: code-lod <command> [arguments]");
        output.println("");
        output.println("Commands:");
        for (LodCommand command : commands.values()) {
            output.printf("  %-15s %s%n", command.getName(), command.getDescription());
        }
        output.printf("  %-15s %s%n", HELP, "Show this help");
    }
}
