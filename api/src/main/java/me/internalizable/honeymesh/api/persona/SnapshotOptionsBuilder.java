package me.internalizable.honeymesh.api.persona;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Builder implementation for snapshot options.
 */
public class SnapshotOptionsBuilder implements PersonaAPI.SnapshotOptions.Builder {

    private int maxDepth = -1;
    private final List<String> exclusions = new ArrayList<>();
    private boolean defaultExclusions = true;

    @Override
    public PersonaAPI.SnapshotOptions.Builder maxDepth(int maxDepth) {
        if (maxDepth < -1) {
            throw new IllegalArgumentException("maxDepth must be -1 or non-negative: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        return this;
    }

    @Override
    public PersonaAPI.SnapshotOptions.Builder exclude(@Nonnull String glob) {
        Objects.requireNonNull(glob, "glob");
        if (glob.isBlank()) {
            throw new IllegalArgumentException("Exclusion glob must not be blank");
        }
        this.exclusions.add(glob);
        return this;
    }

    @Override
    public PersonaAPI.SnapshotOptions.Builder exclude(@Nonnull Collection<String> globs) {
        Objects.requireNonNull(globs, "globs");
        globs.forEach(this::exclude);
        return this;
    }

    @Override
    public PersonaAPI.SnapshotOptions.Builder defaultExclusions(boolean enabled) {
        this.defaultExclusions = enabled;
        return this;
    }

    @Override
    public PersonaAPI.SnapshotOptions build() {
        return new SnapshotOptionsImpl(maxDepth, List.copyOf(exclusions), defaultExclusions);
    }

    private record SnapshotOptionsImpl(
            int maxDepth,
            List<String> exclusions,
            boolean defaultExclusions
    ) implements PersonaAPI.SnapshotOptions {

        @Override
        public int getMaxDepth() {
            return maxDepth;
        }

        @Override
        @Nonnull
        public List<String> getExclusions() {
            return exclusions;
        }

        @Override
        public boolean isDefaultExclusions() {
            return defaultExclusions;
        }
    }
}
