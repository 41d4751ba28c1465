package me.internalizable.honeymesh.api.snapshot;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Attributes shared by every snapshot entry.
 *
 * @param name segment name, never containing a path separator (the root is {@code "/"})
 * @param type kind of the entry
 * @param uid owner user id
 * @param gid owner group id
 * @param size size in bytes
 * @param mode full mode bits, file type included
 * @param modTime modification time in whole seconds since the epoch
 * @param sourceRef reference to externally stored content, unused by snapshots of real trees
 */
public record EntryMetadata(
        @Nonnull String name,
        @Nonnull EntryType type,
        int uid,
        int gid,
        long size,
        int mode,
        long modTime,
        @Nullable String sourceRef
) {
    public EntryMetadata {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Entry name must not be empty");
        }
        if (!name.equals(SnapshotDocument.ROOT_NAME) && name.indexOf('/') >= 0) {
            throw new IllegalArgumentException("Entry name contains a path separator: " + name);
        }
    }

    /**
     * Metadata of a snapshot root: a directory named "/" with zeroed attributes.
     *
     * @return root metadata
     */
    @Nonnull
    public static EntryMetadata root() {
        return new EntryMetadata(SnapshotDocument.ROOT_NAME, EntryType.DIRECTORY, 0, 0, 0, 0, 0, null);
    }
}
