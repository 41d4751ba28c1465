package me.internalizable.honeymesh.persona.template;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * A directory declared by a template, relative to its parent.
 *
 * @param name directory name
 * @param children nested directories in declaration order; empty for a leaf
 */
public record DirNode(@Nonnull String name, @Nonnull List<DirNode> children) {

    public DirNode {
        Objects.requireNonNull(name, "name");
        children = children != null ? List.copyOf(children) : List.of();
    }

    /**
     * Create a directory without children.
     *
     * @param name directory name
     * @return leaf node
     */
    @Nonnull
    public static DirNode leaf(@Nonnull String name) {
        return new DirNode(name, List.of());
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }
}
