package me.internalizable.honeymesh.persona.template;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Exports a {@link TemplateDefinition} back to the YAML layout that
 * {@link TemplateParser} reads.
 */
public class TemplateWriter {

    /**
     * Write a definition to a new file.
     *
     * @param template definition to export
     * @param path target file, which must not exist
     * @throws FileAlreadyExistsException if the target exists
     * @throws IOException if writing fails
     */
    public void write(@Nonnull TemplateDefinition template, @Nonnull Path path) throws IOException {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(path, "path");

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        Yaml yaml = new Yaml(options);

        try (Writer writer = Files.newBufferedWriter(path, StandardOpenOption.CREATE_NEW)) {
            yaml.dump(toDocument(template), writer);
        }
    }

    @Nonnull
    Map<String, Object> toDocument(@Nonnull TemplateDefinition template) {
        Map<String, Object> document = new LinkedHashMap<>();

        PersonaMetadata metadata = template.getMetadata();
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("name", metadata.name());
        meta.put("description", metadata.description());
        meta.put("category", metadata.category());
        meta.put("version", metadata.version());
        meta.put("author", metadata.author());
        document.put("metadata", meta);

        HostConfiguration configuration = template.getConfiguration();
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("hostname", configuration.hostname());
        config.put("ssh_banner", configuration.sshBanner());
        config.put("timezone", configuration.timezone());
        document.put("configuration", config);

        Map<String, Object> users = new LinkedHashMap<>();
        for (UserAccount account : template.getUsers().values()) {
            Map<String, Object> user = new LinkedHashMap<>();
            user.put("password", account.password());
            user.put("uid", account.uid());
            user.put("gid", account.gid());
            user.put("home", account.home());
            user.put("shell", account.shell());
            user.put("gecos", account.description());
            users.put(account.username(), user);
        }
        document.put("users", users);

        document.put("filesystem", toTree(template.getDirectoryTree()));

        Map<String, Object> files = new LinkedHashMap<>();
        template.getFileContents().forEach((path, content) -> files.put(path, Map.of("content", content)));
        document.put("files", files);

        Map<String, Object> commands = new LinkedHashMap<>();
        for (CustomCommand command : template.getCustomCommands().values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("path", command.path());
            entry.put("content", command.content());
            commands.put(command.name(), entry);
        }
        document.put("custom_commands", commands);

        return document;
    }

    private static Map<String, Object> toTree(List<DirNode> nodes) {
        Map<String, Object> tree = new LinkedHashMap<>();
        for (DirNode node : nodes) {
            tree.put(node.name(), toTree(node.children()));
        }
        return tree;
    }
}
