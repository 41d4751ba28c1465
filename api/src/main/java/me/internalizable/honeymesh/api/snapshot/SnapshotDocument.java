package me.internalizable.honeymesh.api.snapshot;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Top-level content of a snapshot artifact.
 *
 * @param format format name, always {@link #FORMAT}
 * @param version format version
 * @param root root directory, named "/"
 */
public record SnapshotDocument(@Nonnull String format, int version, @Nonnull DirectoryEntry root) {

    public static final String FORMAT = "honeymesh-fs";
    public static final int CURRENT_VERSION = 1;
    public static final String ROOT_NAME = "/";

    public SnapshotDocument {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(root, "root");
        if (!ROOT_NAME.equals(root.name())) {
            throw new IllegalArgumentException("Snapshot root must be named '/': " + root.name());
        }
    }

    /**
     * Wrap a root directory in a document of the current version.
     *
     * @param root root directory
     * @return document
     */
    @Nonnull
    public static SnapshotDocument of(@Nonnull DirectoryEntry root) {
        return new SnapshotDocument(FORMAT, CURRENT_VERSION, root);
    }
}
