package me.internalizable.honeymesh.persona.command;

import me.internalizable.honeymesh.api.persona.PersonaAPI;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: honeymesh snapshot &lt;source&gt; &lt;output&gt;
 */
@Command(name = "snapshot", mixinStandardHelpOptions = true, exitCodeOnInvalidInput = 1,
        description = "Snapshot a directory tree into a new artifact")
public class SnapshotCommand implements Callable<Integer> {

    @ParentCommand
    private PersonaCommand parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Directory to snapshot")
    private Path source;

    @Parameters(index = "1", description = "Artifact to write; must not exist")
    private Path output;

    @Option(names = "--max-depth", description = "Directory levels to descend (default: configured)", defaultValue = "-1")
    private int maxDepth;

    @Option(names = {"-x", "--exclude"}, description = "Additional exclusion glob, repeatable")
    private List<String> exclusions = new ArrayList<>();

    @Option(names = "--no-default-exclusions", description = "Do not apply the configured exclusions")
    private boolean noDefaultExclusions;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            PersonaAPI.SnapshotOptions options = PersonaAPI.SnapshotOptions.builder()
                    .maxDepth(maxDepth)
                    .exclude(exclusions)
                    .defaultExclusions(!noDefaultExclusions)
                    .build();
            PersonaAPI.SnapshotSummary summary = parent.openApi().snapshot(source, output, options);

            out.println("[OK] Wrote " + summary.getEntryCount() + " entries to " + summary.getOutput());
            for (String skipped : summary.getSkippedPaths()) {
                out.println("  Skipped: " + skipped);
            }
            return 0;
        } catch (IOException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("[X] Snapshot failed: " + e.getMessage());
            return 1;
        }
    }
}
