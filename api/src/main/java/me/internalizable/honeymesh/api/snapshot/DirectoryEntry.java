package me.internalizable.honeymesh.api.snapshot;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * A directory and its children, in snapshot order.
 */
public record DirectoryEntry(@Nonnull EntryMetadata metadata, @Nonnull List<SnapshotEntry> children)
        implements SnapshotEntry {

    public DirectoryEntry {
        Objects.requireNonNull(metadata, "metadata");
        if (metadata.type() != EntryType.DIRECTORY) {
            throw new IllegalArgumentException("Directory entry with type " + metadata.type());
        }
        children = children != null ? List.copyOf(children) : List.of();
    }

    /**
     * Find a direct child by name.
     *
     * @param name child name
     * @return the child, or null if absent
     */
    @Nullable
    public SnapshotEntry child(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        for (SnapshotEntry child : children) {
            if (child.name().equals(name)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Resolve a "/"-separated path below this directory without following links.
     *
     * @param path path relative to this directory; a leading "/" is ignored
     * @return the entry, or null if any segment is missing
     */
    @Nullable
    public SnapshotEntry lookup(@Nonnull String path) {
        Objects.requireNonNull(path, "path");
        SnapshotEntry current = this;
        for (String segment : path.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (!(current instanceof DirectoryEntry)) {
                return null;
            }
            current = ((DirectoryEntry) current).child(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }
}
