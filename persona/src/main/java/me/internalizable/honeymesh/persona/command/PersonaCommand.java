package me.internalizable.honeymesh.persona.command;

import me.internalizable.honeymesh.api.persona.PersonaAPI;
import me.internalizable.honeymesh.persona.PersonaDeployer;
import me.internalizable.honeymesh.persona.api.PersonaAPIImpl;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Command line for persona deployment.
 *
 * <p>Usage:</p>
 * <ul>
 *   <li>{@code honeymesh templates} - List templates</li>
 *   <li>{@code honeymesh deploy <template> <name>} - Materialize and snapshot a template</li>
 *   <li>{@code honeymesh snapshot <source> <output> [--max-depth=N] [--exclude=GLOB]...} - Snapshot a directory</li>
 * </ul>
 */
@Command(
        name = "honeymesh",
        mixinStandardHelpOptions = true,
        version = "honeymesh 1.0.0",
        description = "Deploy honeypot personas and snapshot their filesystems",
        exitCodeOnInvalidInput = 1,
        subcommands = {
                TemplatesCommand.class,
                DeployCommand.class,
                SnapshotCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class PersonaCommand implements Runnable {

    @Option(
            names = {"-H", "--home"},
            description = "Directory holding config.yml, templates and deployments (default: ${DEFAULT-VALUE})",
            defaultValue = "honeymesh"
    )
    private Path home;

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        System.exit(new CommandLine(new PersonaCommand()).execute(args));
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * Open the persona API on the configured home directory.
     *
     * @return initialized API
     * @throws IOException if the configuration or templates cannot be loaded
     */
    PersonaAPI openApi() throws IOException {
        PersonaDeployer deployer = new PersonaDeployer(home);
        deployer.initialize();
        return new PersonaAPIImpl(deployer);
    }
}
