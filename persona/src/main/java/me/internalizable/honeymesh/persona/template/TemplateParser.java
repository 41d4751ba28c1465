package me.internalizable.honeymesh.persona.template;

import me.internalizable.honeymesh.persona.config.PersonaConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses YAML template definitions into {@link TemplateDefinition}s.
 *
 * <p>The document is read with SnakeYAML's safe constructor into plain maps
 * and then walked section by section. Every shape the schema does not allow
 * is reported as a {@link TemplateParseException} before anything touches
 * the filesystem.</p>
 */
public class TemplateParser {

    /**
     * Deepest directory nesting accepted in the {@code filesystem} section.
     */
    public static final int MAX_TREE_DEPTH = 32;

    static final String DEFAULT_COMMAND_DIR = "/usr/local/bin/";
    static final String DEFAULT_COMMAND_SCRIPT = "#!/bin/bash\necho \"Command not implemented\"\n";

    private final PersonaConfig.TemplateDefaults defaults;

    public TemplateParser() {
        this(new PersonaConfig.TemplateDefaults());
    }

    public TemplateParser(@Nonnull PersonaConfig.TemplateDefaults defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    /**
     * Load a definition from disk. The template id is the file name without extension.
     *
     * @param path definition file
     * @return parsed definition
     * @throws NoSuchFileException if the file does not exist
     * @throws TemplateParseException if the definition is malformed
     * @throws IOException if reading fails
     */
    @Nonnull
    public TemplateDefinition load(@Nonnull Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString(), null, "Template definition not found");
        }
        try (Reader reader = Files.newBufferedReader(path)) {
            return parse(templateId(path), path, reader);
        }
    }

    /**
     * Parse a definition held in memory.
     *
     * @param id template id
     * @param yaml definition text
     * @return parsed definition
     * @throws TemplateParseException if the definition is malformed
     */
    @Nonnull
    public TemplateDefinition parse(@Nonnull String id, @Nonnull String yaml) throws TemplateParseException {
        Objects.requireNonNull(yaml, "yaml");
        try {
            return parse(id, null, new StringReader(yaml));
        } catch (TemplateParseException e) {
            throw e;
        } catch (IOException e) {
            throw new TemplateParseException(id, "unreadable definition", e);
        }
    }

    @Nonnull
    private TemplateDefinition parse(@Nonnull String id, @Nullable Path source, @Nonnull Reader reader)
            throws IOException {
        Objects.requireNonNull(id, "id");

        Object document;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            document = yaml.load(reader);
        } catch (YAMLException e) {
            if (e.getCause() instanceof CharacterCodingException) {
                throw new TemplateParseException(id, "definition is not valid UTF-8", e.getCause());
            }
            if (e.getCause() instanceof IOException) {
                throw (IOException) e.getCause();
            }
            throw new TemplateParseException(id, "malformed YAML: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new TemplateParseException(id, "definition is empty");
        }

        Section root = new Section(id, "document", mapping(id, "document", document));
        return new TemplateDefinition(
                id,
                source,
                parseMetadata(id, root.section("metadata")),
                parseConfiguration(root.section("configuration")),
                parseUsers(id, root.mapping("users")),
                parseDirectories(id, root.get("filesystem"), "filesystem", 1),
                parseFiles(id, root.mapping("files")),
                parseCommands(id, root.mapping("custom_commands"))
        );
    }

    private PersonaMetadata parseMetadata(String id, Section section) throws TemplateParseException {
        String name = section.string("name", id);
        return new PersonaMetadata(
                name.isBlank() ? id : name,
                section.string("description", ""),
                section.string("category", defaults.getCategory()),
                section.string("version", defaults.getVersion()),
                section.string("author", "")
        );
    }

    private HostConfiguration parseConfiguration(Section section) throws TemplateParseException {
        return new HostConfiguration(
                section.string("hostname", defaults.getHostname()),
                section.string("ssh_banner", defaults.getSshBanner()),
                section.string("timezone", defaults.getTimezone())
        );
    }

    private Map<String, UserAccount> parseUsers(String id, Map<String, Object> users)
            throws TemplateParseException {
        Map<String, UserAccount> accounts = new LinkedHashMap<>();
        long nextId = defaults.getFirstUid();

        for (Map.Entry<String, Object> entry : users.entrySet()) {
            String username = entry.getKey();
            validateUsername(id, username);

            Section user;
            if (entry.getValue() instanceof Map<?, ?>) {
                user = new Section(id, "users." + username, mapping(id, "users." + username, entry.getValue()));
            } else {
                Map<String, Object> scalar = new LinkedHashMap<>();
                scalar.put("password", entry.getValue());
                user = new Section(id, "users." + username, scalar);
            }

            Integer explicitUid = user.integer("uid");
            int uid;
            if (explicitUid != null) {
                uid = explicitUid;
                if (uid >= nextId) {
                    nextId = uid + 1L;
                }
            } else {
                if (nextId > Integer.MAX_VALUE) {
                    throw new TemplateParseException(id, "users." + username + ": no uid left above "
                            + Integer.MAX_VALUE);
                }
                uid = (int) nextId++;
            }
            Integer explicitGid = user.integer("gid");

            accounts.put(username, new UserAccount(
                    username,
                    user.string("password", defaults.getPassword()),
                    uid,
                    explicitGid != null ? explicitGid : uid,
                    user.string("home", "/home/" + username),
                    user.string("shell", defaults.getShell()),
                    user.string("gecos", user.string("description", username))
            ));
        }
        return accounts;
    }

    private List<DirNode> parseDirectories(String id, @Nullable Object node, String where, int depth)
            throws TemplateParseException {
        if (node == null || "".equals(node)) {
            return List.of();
        }
        if (depth > MAX_TREE_DEPTH) {
            throw new TemplateParseException(id, where + " nests deeper than " + MAX_TREE_DEPTH + " levels");
        }

        List<DirNode> nodes = new ArrayList<>();
        if (node instanceof List<?>) {
            for (Object name : (List<?>) node) {
                if (name instanceof Map<?, ?>) {
                    nodes.addAll(parseDirectories(id, name, where, depth));
                } else if (isScalar(name)) {
                    nodes.add(DirNode.leaf(directoryName(id, where, String.valueOf(name))));
                } else {
                    throw new TemplateParseException(id, where + " lists a non-scalar directory name");
                }
            }
            return nodes;
        }

        for (Map.Entry<String, Object> entry : mapping(id, where, node).entrySet()) {
            String name = directoryName(id, where, entry.getKey());
            String childWhere = where + "." + name;
            nodes.add(new DirNode(name, parseDirectories(id, entry.getValue(), childWhere, depth + 1)));
        }
        return nodes;
    }

    private Map<String, String> parseFiles(String id, Map<String, Object> files) throws TemplateParseException {
        Map<String, String> contents = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : files.entrySet()) {
            String path = rootedPath(id, "files", entry.getKey());
            Object value = entry.getValue();
            String content;
            if (value instanceof Map<?, ?>) {
                content = new Section(id, "files." + path, mapping(id, "files." + path, value))
                        .string("content", "");
            } else if (value == null) {
                content = "";
            } else if (isScalar(value)) {
                content = String.valueOf(value);
            } else {
                throw new TemplateParseException(id, "files." + path + " must be text or a mapping with 'content'");
            }
            contents.put(path, content);
        }
        return contents;
    }

    private Map<String, CustomCommand> parseCommands(String id, Map<String, Object> commands)
            throws TemplateParseException {
        Map<String, CustomCommand> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : commands.entrySet()) {
            String name = entry.getKey();
            if (name.isBlank() || name.indexOf('/') >= 0) {
                throw new TemplateParseException(id, "invalid custom command name '" + name + "'");
            }
            String where = "custom_commands." + name;
            Object value = entry.getValue();

            String path;
            String content;
            if (value instanceof Map<?, ?>) {
                Section section = new Section(id, where, mapping(id, where, value));
                path = section.string("path", DEFAULT_COMMAND_DIR + name);
                content = section.string("content", DEFAULT_COMMAND_SCRIPT);
            } else if (value == null || isScalar(value)) {
                path = DEFAULT_COMMAND_DIR + name;
                content = value != null ? String.valueOf(value) : DEFAULT_COMMAND_SCRIPT;
            } else {
                throw new TemplateParseException(id, where + " must be script text or a mapping");
            }
            parsed.put(name, new CustomCommand(name, rootedPath(id, where, path), content));
        }
        return parsed;
    }

    private static void validateUsername(String id, String username) throws TemplateParseException {
        if (username.isEmpty()) {
            throw new TemplateParseException(id, "empty username");
        }
        for (int i = 0; i < username.length(); i++) {
            char c = username.charAt(i);
            if (c == ':' || c == '/' || Character.isWhitespace(c)) {
                throw new TemplateParseException(id, "invalid username '" + username + "'");
            }
        }
    }

    private static String directoryName(String id, String where, String name) throws TemplateParseException {
        if (name.isBlank()) {
            throw new TemplateParseException(id, where + " declares a directory with an empty name");
        }
        return name;
    }

    private static String rootedPath(String id, String where, String path) throws TemplateParseException {
        if (!path.startsWith("/")) {
            throw new TemplateParseException(id, where + " path must start with '/': " + path);
        }
        return path;
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static Map<String, Object> mapping(String id, String where, Object value) throws TemplateParseException {
        if (!(value instanceof Map<?, ?>)) {
            throw new TemplateParseException(id, where + " must be a mapping");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    /**
     * Derive a template id from a definition file name.
     *
     * @param path definition file
     * @return file name without its extension
     */
    @Nonnull
    public static String templateId(@Nonnull Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * A mapping section with typed, defaulted accessors.
     */
    private static final class Section {
        private final String id;
        private final String where;
        private final Map<String, Object> values;

        Section(String id, String where, Map<String, Object> values) {
            this.id = id;
            this.where = where;
            this.values = values;
        }

        Object get(String key) {
            return values.get(key);
        }

        Section section(String key) throws TemplateParseException {
            Object value = values.get(key);
            if (value == null) {
                return new Section(id, key, Map.of());
            }
            return new Section(id, key, TemplateParser.mapping(id, key, value));
        }

        Map<String, Object> mapping(String key) throws TemplateParseException {
            Object value = values.get(key);
            return value == null ? Map.of() : TemplateParser.mapping(id, key, value);
        }

        String string(String key, String fallback) throws TemplateParseException {
            Object value = values.get(key);
            if (value == null) {
                return fallback;
            }
            if (!isScalar(value)) {
                throw new TemplateParseException(id, where + "." + key + " must be a scalar");
            }
            return String.valueOf(value);
        }

        @Nullable
        Integer integer(String key) throws TemplateParseException {
            Object value = values.get(key);
            if (value == null) {
                return null;
            }
            if (value instanceof Integer) {
                checkId(key, (Integer) value);
                return (Integer) value;
            }
            if (value instanceof String) {
                String text = (String) value;
                try {
                    int number = Integer.parseInt(text.trim());
                    checkId(key, number);
                    return number;
                } catch (NumberFormatException e) {
                    throw new TemplateParseException(id, where + "." + key + " is not a number: " + text, e);
                }
            }
            throw new TemplateParseException(id, where + "." + key + " must be an integer");
        }

        private void checkId(String key, int number) throws TemplateParseException {
            if (number < 0) {
                throw new TemplateParseException(id, where + "." + key + " must not be negative");
            }
        }
    }
}
