package me.internalizable.honeymesh.api.persona;

import me.internalizable.honeymesh.api.snapshot.SnapshotDocument;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * API for honeypot persona deployment.
 *
 * <p>Provides methods for browsing persona templates, materializing them
 * into a deployment and snapshotting filesystem trees for the honeypot
 * runtime.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * PersonaAPI api = new PersonaAPIImpl(deployer);
 *
 * // Materialize a template and snapshot it
 * DeploymentInfo info = api.deploy("epic_healthcare", "hospital-01");
 * System.out.println("Snapshot written to " + info.getSnapshotPath());
 *
 * // Snapshot an arbitrary tree
 * api.snapshot(Path.of("/srv/fakeroot"), Path.of("fs.json"), SnapshotOptions.builder()
 *     .maxDepth(8)
 *     .exclude("*.bak")
 *     .build());
 * }</pre>
 */
public interface PersonaAPI {

    /**
     * Get all available template ids.
     *
     * @return template ids
     */
    @Nonnull
    Collection<String> getTemplates();

    /**
     * Check if a template exists.
     *
     * @param templateId template id
     * @return true if template exists
     */
    boolean hasTemplate(@Nonnull String templateId);

    /**
     * Get information about a template.
     *
     * @param templateId template id
     * @return template info, or null if not found
     */
    @Nullable
    TemplateInfo getTemplate(@Nonnull String templateId);

    /**
     * Materialize a template into a new deployment and snapshot it.
     *
     * @param templateId template id
     * @param deploymentName name of the deployment directory
     * @return deployment info
     * @throws IOException if any step fails; nothing is snapshotted after a failed materialization
     */
    @Nonnull
    DeploymentInfo deploy(@Nonnull String templateId, @Nonnull String deploymentName) throws IOException;

    /**
     * Snapshot a directory tree into a new artifact.
     *
     * @param source directory to snapshot
     * @param output artifact path, which must not exist
     * @param options snapshot options
     * @return summary of the snapshot
     * @throws IOException if the source is not a directory, the output exists, or writing fails
     */
    @Nonnull
    SnapshotSummary snapshot(@Nonnull Path source, @Nonnull Path output, @Nonnull SnapshotOptions options)
            throws IOException;

    /**
     * Snapshot a directory tree with default options.
     *
     * @param source directory to snapshot
     * @param output artifact path, which must not exist
     * @return summary of the snapshot
     * @throws IOException if the snapshot fails
     */
    @Nonnull
    default SnapshotSummary snapshot(@Nonnull Path source, @Nonnull Path output) throws IOException {
        return snapshot(source, output, SnapshotOptions.defaults());
    }

    /**
     * Read a snapshot artifact back.
     *
     * @param artifact artifact path
     * @return decoded document
     * @throws IOException if the artifact is missing or malformed
     */
    @Nonnull
    SnapshotDocument readSnapshot(@Nonnull Path artifact) throws IOException;

    /**
     * Template information.
     */
    interface TemplateInfo {
        /**
         * Get the template id (definition file name without extension).
         */
        @Nonnull
        String getId();

        /**
         * Get the display name.
         */
        @Nonnull
        String getName();

        /**
         * Get the description.
         */
        @Nonnull
        String getDescription();

        /**
         * Get the category.
         */
        @Nonnull
        String getCategory();

        /**
         * Get the template version.
         */
        @Nonnull
        String getVersion();

        /**
         * Get the emulated hostname.
         */
        @Nonnull
        String getHostname();

        /**
         * Get the declared usernames, in declaration order.
         */
        @Nonnull
        List<String> getUsers();

        /**
         * Get the custom command names.
         */
        @Nonnull
        Collection<String> getCustomCommands();
    }

    /**
     * Deployment information.
     */
    interface DeploymentInfo {
        /**
         * Get the deployment name.
         */
        @Nonnull
        String getName();

        /**
         * Get the template id the deployment was built from.
         */
        @Nonnull
        String getTemplateId();

        /**
         * Get the deployment directory.
         */
        @Nonnull
        Path getDirectory();

        /**
         * Get the materialized filesystem root.
         */
        @Nonnull
        Path getFilesystemRoot();

        /**
         * Get the snapshot artifact path.
         */
        @Nonnull
        Path getSnapshotPath();

        /**
         * Get the snapshot summary.
         */
        @Nonnull
        SnapshotSummary getSnapshot();
    }

    /**
     * Summary of a written snapshot.
     */
    interface SnapshotSummary {
        /**
         * Get the artifact path.
         */
        @Nonnull
        Path getOutput();

        /**
         * Get the number of entries below the root.
         */
        int getEntryCount();

        /**
         * Get the skipped paths, each formatted as {@code path (REASON)}.
         */
        @Nonnull
        List<String> getSkippedPaths();
    }

    /**
     * Options for snapshotting a tree.
     */
    interface SnapshotOptions {
        /**
         * Get the maximum directory depth (-1 for the configured default).
         */
        int getMaxDepth();

        /**
         * Get additional exclusion globs.
         */
        @Nonnull
        List<String> getExclusions();

        /**
         * Check if the default exclusions apply in addition to {@link #getExclusions()}.
         */
        boolean isDefaultExclusions();

        /**
         * Create default snapshot options.
         */
        @Nonnull
        static SnapshotOptions defaults() {
            return builder().build();
        }

        /**
         * Create a builder for snapshot options.
         */
        @Nonnull
        static Builder builder() {
            return new SnapshotOptionsBuilder();
        }

        /**
         * Builder for snapshot options.
         */
        interface Builder {
            Builder maxDepth(int maxDepth);
            Builder exclude(@Nonnull String glob);
            Builder exclude(@Nonnull Collection<String> globs);
            Builder defaultExclusions(boolean enabled);
            SnapshotOptions build();
        }
    }
}
