package me.internalizable.honeymesh.api.snapshot;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A regular file, device, socket or fifo. Contents are never part of a snapshot.
 */
public record LeafEntry(@Nonnull EntryMetadata metadata) implements SnapshotEntry {

    public LeafEntry {
        Objects.requireNonNull(metadata, "metadata");
        if (metadata.type() == EntryType.DIRECTORY || metadata.type() == EntryType.SYMLINK) {
            throw new IllegalArgumentException("Leaf entry with type " + metadata.type());
        }
    }
}
