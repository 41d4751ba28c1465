package me.internalizable.honeymesh.persona.command;

import me.internalizable.honeymesh.api.persona.PersonaAPI;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Collection;
import java.util.concurrent.Callable;

/**
 * CLI command: honeymesh templates
 */
@Command(name = "templates", mixinStandardHelpOptions = true, exitCodeOnInvalidInput = 1,
        description = "List available persona templates")
public class TemplatesCommand implements Callable<Integer> {

    @ParentCommand
    private PersonaCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PersonaAPI api;
        try {
            api = parent.openApi();
        } catch (IOException e) {
            spec.commandLine().getErr().println("[X] Could not load templates: " + e.getMessage());
            return 1;
        }

        Collection<String> templates = api.getTemplates();
        if (templates.isEmpty()) {
            out.println("No templates found.");
            return 0;
        }

        out.println("Templates (" + templates.size() + "):");
        for (String id : templates) {
            PersonaAPI.TemplateInfo info = api.getTemplate(id);
            if (info == null) {
                continue;
            }
            out.printf("  %-24s %s [%s, v%s]%n", info.getId(), info.getName(), info.getCategory(), info.getVersion());
            if (!info.getDescription().isEmpty()) {
                out.println("      " + info.getDescription());
            }
        }
        return 0;
    }
}
