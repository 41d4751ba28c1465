package me.internalizable.honeymesh.api.snapshot;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A symbolic link whose target lies inside the snapshot.
 *
 * @param metadata entry attributes
 * @param linkTarget target path relative to the snapshot root, starting with "/"
 */
public record SymlinkEntry(@Nonnull EntryMetadata metadata, @Nonnull String linkTarget) implements SnapshotEntry {

    public SymlinkEntry {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(linkTarget, "linkTarget");
        if (metadata.type() != EntryType.SYMLINK) {
            throw new IllegalArgumentException("Symlink entry with type " + metadata.type());
        }
        if (!linkTarget.startsWith("/")) {
            throw new IllegalArgumentException("Link target must be rooted: " + linkTarget);
        }
    }
}
