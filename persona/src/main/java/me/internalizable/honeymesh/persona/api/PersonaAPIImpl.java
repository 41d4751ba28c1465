package me.internalizable.honeymesh.persona.api;

import me.internalizable.honeymesh.api.persona.PersonaAPI;
import me.internalizable.honeymesh.api.snapshot.SnapshotDocument;
import me.internalizable.honeymesh.persona.PersonaDeployer;
import me.internalizable.honeymesh.persona.snapshot.SkippedPath;
import me.internalizable.honeymesh.persona.snapshot.SnapshotCodec;
import me.internalizable.honeymesh.persona.snapshot.SnapshotResult;
import me.internalizable.honeymesh.persona.template.PersonaMetadata;
import me.internalizable.honeymesh.persona.template.TemplateDefinition;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Implementation of the PersonaAPI on top of a {@link PersonaDeployer}.
 */
public class PersonaAPIImpl implements PersonaAPI {

    private final PersonaDeployer deployer;
    private final SnapshotCodec codec = new SnapshotCodec();

    public PersonaAPIImpl(@Nonnull PersonaDeployer deployer) {
        this.deployer = Objects.requireNonNull(deployer, "deployer");
    }

    @Override
    @Nonnull
    public Collection<String> getTemplates() {
        return deployer.getLibrary().getAllTemplates().stream()
                .map(TemplateDefinition::getId)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public boolean hasTemplate(@Nonnull String templateId) {
        Objects.requireNonNull(templateId, "templateId");
        return deployer.getLibrary().hasTemplate(templateId);
    }

    @Override
    @Nullable
    public TemplateInfo getTemplate(@Nonnull String templateId) {
        Objects.requireNonNull(templateId, "templateId");
        TemplateDefinition template = deployer.getLibrary().getTemplate(templateId);
        return template != null ? toTemplateInfo(template) : null;
    }

    @Override
    @Nonnull
    public DeploymentInfo deploy(@Nonnull String templateId, @Nonnull String deploymentName) throws IOException {
        PersonaDeployer.DeploymentResult result = deployer.deploy(templateId, deploymentName);
        return new DeploymentInfoImpl(
                result.name(),
                result.templateId(),
                result.directory(),
                result.filesystemRoot(),
                result.snapshotPath(),
                toSummary(result.snapshotPath(), result.snapshot())
        );
    }

    @Override
    @Nonnull
    public SnapshotSummary snapshot(@Nonnull Path source, @Nonnull Path output, @Nonnull SnapshotOptions options)
            throws IOException {
        Objects.requireNonNull(options, "options");
        SnapshotResult result = deployer.snapshot(source, output, options.getMaxDepth(),
                options.getExclusions(), options.isDefaultExclusions());
        return toSummary(output, result);
    }

    @Override
    @Nonnull
    public SnapshotDocument readSnapshot(@Nonnull Path artifact) throws IOException {
        Objects.requireNonNull(artifact, "artifact");
        return codec.read(artifact);
    }

    private TemplateInfo toTemplateInfo(TemplateDefinition template) {
        PersonaMetadata metadata = template.getMetadata();
        return new TemplateInfoImpl(
                template.getId(),
                metadata.name(),
                metadata.description(),
                metadata.category(),
                metadata.version(),
                template.getConfiguration().hostname(),
                List.copyOf(template.getUsers().keySet()),
                List.copyOf(template.getCustomCommands().keySet())
        );
    }

    private SnapshotSummary toSummary(Path output, SnapshotResult result) {
        return new SnapshotSummaryImpl(
                output,
                result.entryCount(),
                result.skipped().stream()
                        .map(SkippedPath::toString)
                        .collect(Collectors.toUnmodifiableList())
        );
    }

    private record TemplateInfoImpl(
            String id,
            String name,
            String description,
            String category,
            String version,
            String hostname,
            List<String> users,
            List<String> customCommands
    ) implements TemplateInfo {

        @Override
        @Nonnull
        public String getId() {
            return id;
        }

        @Override
        @Nonnull
        public String getName() {
            return name;
        }

        @Override
        @Nonnull
        public String getDescription() {
            return description;
        }

        @Override
        @Nonnull
        public String getCategory() {
            return category;
        }

        @Override
        @Nonnull
        public String getVersion() {
            return version;
        }

        @Override
        @Nonnull
        public String getHostname() {
            return hostname;
        }

        @Override
        @Nonnull
        public List<String> getUsers() {
            return users;
        }

        @Override
        @Nonnull
        public Collection<String> getCustomCommands() {
            return customCommands;
        }
    }

    private record DeploymentInfoImpl(
            String name,
            String templateId,
            Path directory,
            Path filesystemRoot,
            Path snapshotPath,
            SnapshotSummary snapshot
    ) implements DeploymentInfo {

        @Override
        @Nonnull
        public String getName() {
            return name;
        }

        @Override
        @Nonnull
        public String getTemplateId() {
            return templateId;
        }

        @Override
        @Nonnull
        public Path getDirectory() {
            return directory;
        }

        @Override
        @Nonnull
        public Path getFilesystemRoot() {
            return filesystemRoot;
        }

        @Override
        @Nonnull
        public Path getSnapshotPath() {
            return snapshotPath;
        }

        @Override
        @Nonnull
        public SnapshotSummary getSnapshot() {
            return snapshot;
        }
    }

    private record SnapshotSummaryImpl(
            Path output,
            int entryCount,
            List<String> skippedPaths
    ) implements SnapshotSummary {

        @Override
        @Nonnull
        public Path getOutput() {
            return output;
        }

        @Override
        public int getEntryCount() {
            return entryCount;
        }

        @Override
        @Nonnull
        public List<String> getSkippedPaths() {
            return skippedPaths;
        }
    }
}
