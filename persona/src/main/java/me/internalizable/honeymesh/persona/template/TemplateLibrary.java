package me.internalizable.honeymesh.persona.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Manages persona template definitions on disk.
 *
 * <p>Discovers {@code *.yaml} and {@code *.yml} definitions in the templates
 * directory, parses and caches them, and saves new definitions back.
 * Template ids are file names without extension and are looked up
 * case-insensitively.</p>
 */
public class TemplateLibrary {

    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateLibrary.class);

    private static final String DEFINITION_GLOB = "*.{yaml,yml}";

    private final Path templatesDirectory;
    private final TemplateParser parser;
    private final TemplateWriter writer = new TemplateWriter();
    private final Map<String, TemplateDefinition> templates = new ConcurrentHashMap<>();

    /**
     * Create a template library.
     *
     * @param templatesDirectory path to templates directory
     * @param parser parser used for every definition
     */
    public TemplateLibrary(@Nonnull Path templatesDirectory, @Nonnull TemplateParser parser) {
        this.templatesDirectory = Objects.requireNonNull(templatesDirectory, "templatesDirectory");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * Initialize the library and discover all templates.
     *
     * @throws IOException if the templates directory cannot be created
     */
    public void initialize() throws IOException {
        ensureDirectoryExists();
        reloadTemplates();
    }

    private void ensureDirectoryExists() throws IOException {
        if (!Files.exists(templatesDirectory)) {
            Files.createDirectories(templatesDirectory);
            LOGGER.info("Created templates directory: {}", templatesDirectory);
        }
    }

    /**
     * Load a single definition without caching it.
     *
     * @param path definition file
     * @return parsed definition
     * @throws IOException if the file is missing, unreadable or malformed
     */
    @Nonnull
    public TemplateDefinition load(@Nonnull Path path) throws IOException {
        return parser.load(path);
    }

    /**
     * Drop the cache and load all templates from the templates directory.
     * Definitions that fail to parse are logged and skipped.
     *
     * @return number of templates loaded
     */
    public int reloadTemplates() {
        templates.clear();
        int loaded = 0;

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(templatesDirectory, DEFINITION_GLOB)) {
            for (Path entry : stream) {
                if (!Files.isRegularFile(entry)) {
                    continue;
                }
                String id = TemplateParser.templateId(entry);
                try {
                    TemplateDefinition template = parser.load(entry);
                    if (templates.putIfAbsent(key(id), template) == null) {
                        loaded++;
                        LOGGER.info("Loaded template: {}", id);
                    } else {
                        LOGGER.warn("Duplicate template id '{}' in {}, keeping the first", id, entry);
                    }
                } catch (IOException e) {
                    LOGGER.error("Failed to load template '{}': {}", id, e.getMessage());
                }
            }
        } catch (IOException e) {
            LOGGER.error("Failed to scan templates directory: {}", e.getMessage());
        }

        LOGGER.info("Loaded {} template(s)", loaded);
        return loaded;
    }

    /**
     * Reload a specific template from disk.
     *
     * @param id template id
     * @return true if reload was successful
     */
    public boolean reloadTemplate(@Nonnull String id) {
        Objects.requireNonNull(id, "id");

        Path definition = findDefinition(id);
        if (definition == null) {
            templates.remove(key(id));
            LOGGER.warn("Template '{}' no longer exists on disk", id);
            return false;
        }

        try {
            templates.put(key(id), parser.load(definition));
            LOGGER.info("Reloaded template: {}", id);
            return true;
        } catch (IOException e) {
            LOGGER.error("Failed to reload template '{}': {}", id, e.getMessage());
            return false;
        }
    }

    /**
     * Parse a definition from anywhere on disk and register it under its file name.
     *
     * @param path definition file
     * @return true if the definition was added
     */
    public boolean addTemplateFromFile(@Nonnull Path path) {
        Objects.requireNonNull(path, "path");
        try {
            TemplateDefinition template = parser.load(path);
            templates.put(key(template.getId()), template);
            LOGGER.info("Added template '{}' from {}", template.getId(), path);
            return true;
        } catch (IOException e) {
            LOGGER.error("Failed to add template from {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * Write a definition into the templates directory and register it.
     *
     * @param template definition to save
     * @return path of the written definition
     * @throws IOException if a definition with the same id already exists or writing fails
     */
    @Nonnull
    public Path saveTemplate(@Nonnull TemplateDefinition template) throws IOException {
        Objects.requireNonNull(template, "template");

        if (hasTemplate(template.getId()) || findDefinition(template.getId()) != null) {
            throw new IOException("Template already exists: " + template.getId());
        }

        Path path = templatesDirectory.resolve(template.getId() + ".yaml");
        writer.write(template, path);
        templates.put(key(template.getId()), parser.load(path));
        LOGGER.info("Saved template '{}' to {}", template.getId(), path);
        return path;
    }

    /**
     * Get a template by id.
     *
     * @param id template id (case-insensitive)
     * @return the template, or null if not found
     */
    @Nullable
    public TemplateDefinition getTemplate(@Nonnull String id) {
        Objects.requireNonNull(id, "id");
        return templates.get(key(id));
    }

    public boolean hasTemplate(@Nonnull String id) {
        return templates.containsKey(key(id));
    }

    /**
     * Get all loaded templates.
     *
     * @return unmodifiable collection of templates
     */
    @Nonnull
    public Collection<TemplateDefinition> getAllTemplates() {
        return Collections.unmodifiableCollection(templates.values());
    }

    /**
     * Get all template ids, as declared by their file names.
     *
     * @return unmodifiable set of ids
     */
    @Nonnull
    public Set<String> getTemplateIds() {
        return templates.values().stream()
                .map(TemplateDefinition::getId)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Summarize all templates, ordered by id.
     *
     * @return template summaries
     */
    @Nonnull
    public List<TemplateSummary> listTemplates() {
        return templates.values().stream()
                .map(TemplateSummary::of)
                .sorted(Comparator.comparing(TemplateSummary::id))
                .collect(Collectors.toList());
    }

    /**
     * Summarize the templates of one category, ordered by id.
     *
     * @param category category name (case-insensitive)
     * @return matching template summaries
     */
    @Nonnull
    public List<TemplateSummary> getTemplatesByCategory(@Nonnull String category) {
        Objects.requireNonNull(category, "category");
        return listTemplates().stream()
                .filter(summary -> summary.category().equalsIgnoreCase(category))
                .collect(Collectors.toList());
    }

    @Nonnull
    public Path getTemplatesDirectory() {
        return templatesDirectory;
    }

    @Nullable
    private Path findDefinition(String id) {
        for (String extension : List.of(".yaml", ".yml")) {
            Path candidate = templatesDirectory.resolve(id + extension);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static String key(String id) {
        return id.toLowerCase(Locale.ROOT);
    }

    /**
     * Short description of a template for listings.
     */
    public record TemplateSummary(String id, String name, String description, String category, String version) {

        static TemplateSummary of(TemplateDefinition template) {
            PersonaMetadata metadata = template.getMetadata();
            return new TemplateSummary(template.getId(), metadata.name(), metadata.description(),
                    metadata.category(), metadata.version());
        }
    }
}
