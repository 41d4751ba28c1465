package me.internalizable.honeymesh.persona.snapshot;

import me.internalizable.honeymesh.api.snapshot.DirectoryEntry;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of a snapshot walk.
 *
 * @param root snapshot root, named "/"
 * @param entryCount number of entries below the root
 * @param skipped paths left out, in walk order
 */
public record SnapshotResult(@Nonnull DirectoryEntry root, int entryCount, @Nonnull List<SkippedPath> skipped) {

    public SnapshotResult {
        Objects.requireNonNull(root, "root");
        skipped = skipped != null ? List.copyOf(skipped) : List.of();
    }

    /**
     * Get the skipped paths with a given reason.
     *
     * @param reason reason to filter by
     * @return matching skipped paths
     */
    @Nonnull
    public List<SkippedPath> skipped(@Nonnull SkippedPath.Reason reason) {
        return skipped.stream()
                .filter(path -> path.reason() == reason)
                .collect(Collectors.toList());
    }
}
