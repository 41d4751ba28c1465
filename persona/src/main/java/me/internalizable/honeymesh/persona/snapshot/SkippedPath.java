package me.internalizable.honeymesh.persona.snapshot;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A path the snapshot walk left out, and why.
 *
 * @param virtualPath path relative to the snapshot root
 * @param reason why the path was left out
 * @param detail human-readable detail, such as the underlying error
 */
public record SkippedPath(@Nonnull String virtualPath, @Nonnull Reason reason, @Nonnull String detail) {

    public SkippedPath {
        Objects.requireNonNull(virtualPath, "virtualPath");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(detail, "detail");
    }

    @Override
    public String toString() {
        return virtualPath + " (" + reason + ")";
    }

    public enum Reason {
        /**
         * Matched an exclusion pattern.
         */
        EXCLUDED,

        /**
         * Directory could not be listed; its contents are missing.
         */
        UNREADABLE_DIRECTORY,

        /**
         * Attributes could not be read, usually because the entry vanished.
         */
        STAT_FAILED,

        /**
         * Symbolic link is dangling or loops.
         */
        UNRESOLVABLE_LINK,

        /**
         * Symbolic link resolves outside the snapshot root.
         */
        LINK_ESCAPES_ROOT
    }
}
