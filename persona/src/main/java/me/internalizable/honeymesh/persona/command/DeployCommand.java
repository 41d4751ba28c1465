package me.internalizable.honeymesh.persona.command;

import me.internalizable.honeymesh.api.persona.PersonaAPI;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * CLI command: honeymesh deploy &lt;template&gt; &lt;name&gt;
 */
@Command(name = "deploy", mixinStandardHelpOptions = true, exitCodeOnInvalidInput = 1,
        description = "Materialize a template into a new deployment and snapshot it")
public class DeployCommand implements Callable<Integer> {

    @ParentCommand
    private PersonaCommand parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Template id")
    private String templateId;

    @Parameters(index = "1", description = "Deployment name")
    private String deploymentName;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            PersonaAPI.DeploymentInfo info = parent.openApi().deploy(templateId, deploymentName);
            out.println("[OK] Deployed '" + info.getName() + "' from template '" + info.getTemplateId() + "'");
            out.println("  Filesystem: " + info.getFilesystemRoot());
            out.println("  Snapshot:   " + info.getSnapshotPath()
                    + " (" + info.getSnapshot().getEntryCount() + " entries)");
            for (String skipped : info.getSnapshot().getSkippedPaths()) {
                out.println("  Skipped:    " + skipped);
            }
            return 0;
        } catch (IOException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("[X] Deployment failed: " + e.getMessage());
            return 1;
        }
    }
}
