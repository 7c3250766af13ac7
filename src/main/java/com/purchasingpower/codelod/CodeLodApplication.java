package com.purchasingpower.codelod;

import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.core.CodeLodPaths;
import com.purchasingpower.codelod.core.ProjectRootLocator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

@SpringBootApplication
public class CodeLodApplication {

    static final String ROOT_DIR_PROPERTY = "codelod.root-dir";

    /**
     * Profile for runs that must not touch the disk: in-memory index, console logging only.
     */
    static final String TRANSIENT_PROFILE = "transient";

    private static final Set<String> PROJECTLESS_COMMANDS = Set.of("init", "help");

    public static void main(String[] args) {
        CommandArguments arguments = CommandArguments.parse(args);
        Optional<String> command = arguments.command();
        boolean projectless = command.isEmpty()
            || PROJECTLESS_COMMANDS.contains(command.get())
            || arguments.hasOption("help");

        Path cwd = Path.of("").toAbsolutePath();
        Path root = command.filter("init"::equals).isPresent()
            ? cwd
            : ProjectRootLocator.locate(cwd).orElse(cwd);

        // The index database and log file live under .code-lod, so booting would create it
        boolean initialized = CodeLodPaths.of(root).isInitialized();
        if (!projectless && !initialized) {
            System.err.println("code-lod not initialized in " + root + ". Run 'code-lod init' first.");
            System.exit(1);
        }

        System.setProperty(ROOT_DIR_PROPERTY, root.toString());
        SpringApplication application = new SpringApplication(CodeLodApplication.class);
        if (!initialized && command.filter("init"::equals).isEmpty()) {
            application.setAdditionalProfiles(TRANSIENT_PROFILE);
        }
        System.exit(SpringApplication.exit(application.run(args)));
    }
}
