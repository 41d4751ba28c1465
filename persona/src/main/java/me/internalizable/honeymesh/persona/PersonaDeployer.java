package me.internalizable.honeymesh.persona;

import me.internalizable.honeymesh.persona.config.PersonaConfig;
import me.internalizable.honeymesh.persona.materialize.TemplateMaterializer;
import me.internalizable.honeymesh.persona.snapshot.ExclusionPolicy;
import me.internalizable.honeymesh.persona.snapshot.FilesystemSnapshotter;
import me.internalizable.honeymesh.persona.snapshot.SnapshotCodec;
import me.internalizable.honeymesh.persona.snapshot.SnapshotResult;
import me.internalizable.honeymesh.persona.template.TemplateDefinition;
import me.internalizable.honeymesh.persona.template.TemplateLibrary;
import me.internalizable.honeymesh.persona.template.TemplateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Main orchestrator for persona deployment.
 *
 * <p>Coordinates the template library, the materializer and the snapshot
 * serializer. A deployment either completes every step or is removed
 * again.</p>
 *
 * <h2>Directory Structure</h2>
 * <pre>
 * honeymesh/
 * ├── config.yml              # Persona configuration
 * ├── templates/              # Template definitions
 * │   ├── corporate_fileserver.yaml
 * │   └── epic_healthcare.yaml
 * └── deployments/
 *     └── hospital-01/
 *         ├── honeyfs/        # Materialized filesystem
 *         ├── txtcmds/        # Custom command scripts
 *         ├── config/userdb.txt
 *         ├── share/fs.json   # Snapshot artifact
 *         └── deployment.yml  # Deployment record
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * PersonaDeployer deployer = new PersonaDeployer();
 * deployer.initialize();
 *
 * DeploymentResult result = deployer.deploy("epic_healthcare", "hospital-01");
 * }</pre>
 */
public class PersonaDeployer {

    private static final Logger LOGGER = LoggerFactory.getLogger(PersonaDeployer.class);

    public static final Path DEFAULT_HOME = Paths.get("honeymesh");

    static final String FILESYSTEM_DIR = "honeyfs";
    static final String COMMANDS_DIR = "txtcmds";
    static final String USERDB_PATH = "config/userdb.txt";
    static final String SHARE_DIR = "share";
    static final String RECORD_FILE = "deployment.yml";

    private static final Pattern DEPLOYMENT_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path home;

    private PersonaConfig config;
    private TemplateLibrary library;
    private TemplateMaterializer materializer;
    private FilesystemSnapshotter snapshotter;
    private Path deploymentsDirectory;

    private volatile boolean initialized = false;

    public PersonaDeployer() {
        this(DEFAULT_HOME);
    }

    /**
     * Create a deployer.
     *
     * @param home directory holding {@code config.yml}, templates and deployments
     */
    public PersonaDeployer(@Nonnull Path home) {
        this.home = Objects.requireNonNull(home, "home");
    }

    // ==================== Initialization ====================

    /**
     * Load the configuration and discover templates.
     *
     * @throws IOException if the configuration cannot be loaded or directories cannot be created
     */
    public void initialize() throws IOException {
        if (initialized) {
            throw new IllegalStateException("Persona deployer already initialized");
        }

        LOGGER.info("Initializing persona deployer in {}", home.toAbsolutePath());

        Files.createDirectories(home);
        config = PersonaConfig.load(home.resolve("config.yml"));
        configure();

        initialized = true;
        LOGGER.info("Persona deployer initialized");
        LOGGER.info("  Templates: {}", library.getTemplateIds().size());
        LOGGER.info("  Deployments: {}", deploymentsDirectory);
    }

    private void configure() throws IOException {
        deploymentsDirectory = home.resolve(config.getDeploymentsDirectory());
        Files.createDirectories(deploymentsDirectory);

        library = new TemplateLibrary(home.resolve(config.getTemplatesDirectory()),
                new TemplateParser(config.getTemplateDefaults()));
        library.initialize();

        materializer = new TemplateMaterializer();
        snapshotter = new FilesystemSnapshotter(config.getSnapshot().getMaxDepth(),
                ExclusionPolicy.of(config.getSnapshot().getExclusionPatterns()), new SnapshotCodec());
    }

    /**
     * Reload configuration and templates.
     *
     * @throws IOException if reload fails
     */
    public void reload() throws IOException {
        checkInitialized();
        LOGGER.info("Reloading persona deployer...");

        config = PersonaConfig.load(home.resolve("config.yml"));
        configure();

        LOGGER.info("Persona deployer reloaded");
    }

    // ==================== Deployment ====================

    /**
     * Materialize a template into a new deployment and snapshot the result.
     *
     * <p>Steps run in order: directories, files and commands, the credential
     * database, the snapshot, then the deployment record. If any step fails
     * the deployment directory is removed and the failure is rethrown.</p>
     *
     * @param templateId template id
     * @param deploymentName name of the deployment directory
     * @return the deployment
     * @throws IllegalArgumentException if the template is unknown or the name is not a plain directory name
     * @throws java.nio.file.FileAlreadyExistsException if the deployment already exists
     * @throws IOException if any step fails
     */
    @Nonnull
    public DeploymentResult deploy(@Nonnull String templateId, @Nonnull String deploymentName) throws IOException {
        checkInitialized();
        Objects.requireNonNull(templateId, "templateId");
        Objects.requireNonNull(deploymentName, "deploymentName");

        if (!DEPLOYMENT_NAME.matcher(deploymentName).matches()) {
            throw new IllegalArgumentException("Invalid deployment name: " + deploymentName);
        }
        TemplateDefinition template = library.getTemplate(templateId);
        if (template == null) {
            throw new IllegalArgumentException("Template not found: " + templateId);
        }

        Path directory = deploymentsDirectory.resolve(deploymentName);
        Files.createDirectory(directory);

        try {
            Path filesystemRoot = directory.resolve(FILESYSTEM_DIR);
            Path commandsRoot = directory.resolve(COMMANDS_DIR);
            materializer.materialize(template, filesystemRoot, commandsRoot);
            materializer.writeCredentialDatabase(template, directory.resolve(USERDB_PATH));

            Path artifact = directory.resolve(SHARE_DIR).resolve(config.getSnapshot().getArtifactName());
            SnapshotResult snapshot = snapshotter.snapshot(filesystemRoot, artifact);

            DeploymentResult result = new DeploymentResult(deploymentName, template.getId(), directory,
                    filesystemRoot, commandsRoot, artifact, snapshot);
            writeRecord(result, template);

            LOGGER.info("Deployment '{}' created from template '{}' ({} entries)",
                    deploymentName, template.getId(), snapshot.entryCount());
            return result;
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Deployment '{}' failed: {}", deploymentName, e.getMessage());
            try {
                deleteDirectory(directory);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /**
     * Snapshot an arbitrary directory tree.
     *
     * @param source directory to snapshot
     * @param output artifact path, which must not exist
     * @param maxDepth depth limit, or -1 for the configured one
     * @param exclusions additional exclusion globs
     * @param defaultExclusions whether the configured exclusions apply as well
     * @return snapshot result
     * @throws IOException if the source is not a directory, the output exists, or writing fails
     */
    @Nonnull
    public SnapshotResult snapshot(@Nonnull Path source, @Nonnull Path output, int maxDepth,
                                   @Nonnull Collection<String> exclusions, boolean defaultExclusions)
            throws IOException {
        checkInitialized();
        Objects.requireNonNull(exclusions, "exclusions");

        int depth = maxDepth < 0 ? snapshotter.getMaxDepth() : maxDepth;
        ExclusionPolicy policy = defaultExclusions
                ? snapshotter.getExclusions().with(exclusions)
                : ExclusionPolicy.of(exclusions);

        return new FilesystemSnapshotter(depth, policy, new SnapshotCodec()).snapshot(source, output);
    }

    private void writeRecord(DeploymentResult result, TemplateDefinition template) throws IOException {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("name", result.name());
        record.put("template", template.getId());
        record.put("templateName", template.getMetadata().name());
        record.put("templateVersion", template.getMetadata().version());
        record.put("hostname", template.getConfiguration().hostname());
        record.put("sshBanner", template.getConfiguration().sshBanner());
        record.put("timezone", template.getConfiguration().timezone());
        record.put("users", List.copyOf(template.getUsers().keySet()));
        record.put("commands", List.copyOf(template.getCustomCommands().keySet()));
        record.put("snapshot", result.directory().relativize(result.snapshotPath()).toString());
        record.put("entries", result.snapshot().entryCount());
        record.put("skipped", result.snapshot().skipped().stream()
                .map(Object::toString)
                .collect(Collectors.toList()));
        record.put("createdAt", Instant.now().toString());

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Files.writeString(result.directory().resolve(RECORD_FILE), new Yaml(options).dump(record));
    }

    private void deleteDirectory(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
        LOGGER.debug("Removed deployment directory {}", directory);
    }

    // ==================== Queries ====================

    @Nonnull
    public Path getHome() {
        return home;
    }

    @Nonnull
    public Path getDeploymentsDirectory() {
        checkInitialized();
        return deploymentsDirectory;
    }

    @Nonnull
    public PersonaConfig getConfig() {
        checkInitialized();
        return config;
    }

    @Nonnull
    public TemplateLibrary getLibrary() {
        checkInitialized();
        return library;
    }

    @Nonnull
    public FilesystemSnapshotter getSnapshotter() {
        checkInitialized();
        return snapshotter;
    }

    public boolean isInitialized() {
        return initialized;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Persona deployer not initialized");
        }
    }

    /**
     * A completed deployment.
     *
     * @param name deployment name
     * @param templateId template the deployment was built from
     * @param directory deployment directory
     * @param filesystemRoot materialized filesystem
     * @param commandsRoot custom command scripts
     * @param snapshotPath snapshot artifact
     * @param snapshot snapshot of the materialized filesystem
     */
    public record DeploymentResult(
            @Nonnull String name,
            @Nonnull String templateId,
            @Nonnull Path directory,
            @Nonnull Path filesystemRoot,
            @Nonnull Path commandsRoot,
            @Nonnull Path snapshotPath,
            @Nonnull SnapshotResult snapshot
    ) {
    }
}
