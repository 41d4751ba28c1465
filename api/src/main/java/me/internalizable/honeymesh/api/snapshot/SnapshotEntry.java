package me.internalizable.honeymesh.api.snapshot;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import javax.annotation.Nonnull;

/**
 * A node in a filesystem snapshot.
 *
 * <p>Exactly one of three shapes: a {@link DirectoryEntry} with children,
 * a {@link SymlinkEntry} with a link target, or a {@link LeafEntry} with
 * neither. The encoded form names the shape in a {@code kind} property.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DirectoryEntry.class, name = "directory"),
        @JsonSubTypes.Type(value = SymlinkEntry.class, name = "symlink"),
        @JsonSubTypes.Type(value = LeafEntry.class, name = "leaf")
})
public interface SnapshotEntry {

    /**
     * Get the attributes of this entry.
     *
     * @return entry metadata
     */
    @Nonnull
    EntryMetadata metadata();

    /**
     * Get the segment name.
     *
     * @return entry name
     */
    @Nonnull
    default String name() {
        return metadata().name();
    }

    /**
     * Get the entry kind.
     *
     * @return entry type
     */
    @Nonnull
    default EntryType type() {
        return metadata().type();
    }
}
