package me.internalizable.honeymesh.persona.template;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A honeypot persona loaded from a YAML definition.
 *
 * <p>Definitions are immutable once parsed. Maps preserve declaration order so
 * that materialization and generated credential files are reproducible.</p>
 *
 * <h2>Definition Layout</h2>
 * <pre>
 * metadata:          # name, description, category, version, author
 * configuration:     # hostname, ssh_banner, timezone
 * users:             # username -> {password, uid, gid, home, shell, gecos} or password
 * filesystem:        # nested directory mapping, {} or null for a leaf
 * files:             # /rooted/path -> {content} or text
 * custom_commands:   # name -> {path, content} or script text
 * </pre>
 */
public final class TemplateDefinition {

    private final String id;
    private final Path source;
    private final PersonaMetadata metadata;
    private final HostConfiguration configuration;
    private final Map<String, UserAccount> users;
    private final List<DirNode> directoryTree;
    private final Map<String, String> fileContents;
    private final Map<String, CustomCommand> customCommands;

    public TemplateDefinition(@Nonnull String id,
                              @Nullable Path source,
                              @Nonnull PersonaMetadata metadata,
                              @Nonnull HostConfiguration configuration,
                              @Nonnull Map<String, UserAccount> users,
                              @Nonnull List<DirNode> directoryTree,
                              @Nonnull Map<String, String> fileContents,
                              @Nonnull Map<String, CustomCommand> customCommands) {
        this.id = Objects.requireNonNull(id, "id");
        this.source = source;
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.users = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(users, "users")));
        this.directoryTree = List.copyOf(Objects.requireNonNull(directoryTree, "directoryTree"));
        this.fileContents = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(fileContents, "fileContents")));
        this.customCommands = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(customCommands, "customCommands")));
    }

    /**
     * Get the template id (definition file name without extension).
     *
     * @return template id
     */
    @Nonnull
    public String getId() {
        return id;
    }

    /**
     * Get the file this definition was loaded from.
     *
     * @return source file, or null if parsed from memory
     */
    @Nullable
    public Path getSource() {
        return source;
    }

    @Nonnull
    public PersonaMetadata getMetadata() {
        return metadata;
    }

    @Nonnull
    public HostConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Get the user accounts keyed by username, in declaration order.
     *
     * @return unmodifiable user map
     */
    @Nonnull
    public Map<String, UserAccount> getUsers() {
        return users;
    }

    /**
     * Get the top-level directories declared by the template.
     *
     * @return directory roots relative to the materialization root
     */
    @Nonnull
    public List<DirNode> getDirectoryTree() {
        return directoryTree;
    }

    /**
     * Get the literal file contents keyed by rooted path.
     *
     * @return unmodifiable path to content map
     */
    @Nonnull
    public Map<String, String> getFileContents() {
        return fileContents;
    }

    @Nonnull
    public Map<String, CustomCommand> getCustomCommands() {
        return customCommands;
    }

    /**
     * Get the message of the day, if the template ships one.
     *
     * @return contents of /etc/motd, or null
     */
    @Nullable
    public String getMotd() {
        return fileContents.get("/etc/motd");
    }

    @Override
    public String toString() {
        return "TemplateDefinition{" +
                "id='" + id + '\'' +
                ", name='" + metadata.name() + '\'' +
                ", users=" + users.size() +
                ", files=" + fileContents.size() +
                ", commands=" + customCommands.size() +
                '}';
    }
}
