package me.internalizable.honeymesh.persona.materialize;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Joins rooted template paths onto a materialization root and rejects any
 * result that leaves it.
 */
final class PathGuard {

    private final Path root;

    PathGuard(@Nonnull Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    @Nonnull
    Path root() {
        return root;
    }

    /**
     * Resolve a declared path lexically. Nothing on disk is consulted.
     *
     * @param declared path as written in the template, usually "/"-prefixed
     * @return normalized absolute target strictly below the root
     * @throws PathViolationException if the target is the root itself or escapes it
     */
    @Nonnull
    Path resolve(@Nonnull String declared) throws PathViolationException {
        Objects.requireNonNull(declared, "declared");

        int start = 0;
        while (start < declared.length() && declared.charAt(start) == '/') {
            start++;
        }
        String relative = declared.substring(start);
        if (relative.isEmpty()) {
            throw new PathViolationException(declared, root, "path names the root itself");
        }

        Path relativePath;
        try {
            relativePath = root.getFileSystem().getPath(relative);
        } catch (InvalidPathException e) {
            throw new PathViolationException(declared, root, "invalid path: " + e.getReason());
        }
        if (relativePath.isAbsolute()) {
            throw new PathViolationException(declared, root, "absolute path overrides the root");
        }

        Path target = root.resolve(relativePath).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new PathViolationException(declared, root, "path escapes the root");
        }
        return target;
    }

    /**
     * Check that the deepest existing ancestor of a target, the target itself
     * included, does not lead outside the root through a symbolic link.
     *
     * @param declared path as written in the template, for error reporting
     * @param target resolved target
     * @throws PathViolationException if a link leads outside the root or cannot be resolved
     * @throws IOException if the root cannot be resolved
     */
    void checkOnDisk(@Nonnull String declared, @Nonnull Path target) throws IOException {
        Path probe = target;
        while (probe != null && !Files.exists(probe, LinkOption.NOFOLLOW_LINKS)) {
            probe = probe.getParent();
        }
        if (probe == null || !probe.startsWith(root)) {
            return;
        }

        Path realRoot = root.toRealPath();
        Path real;
        try {
            real = probe.toRealPath();
        } catch (IOException e) {
            throw new PathViolationException(declared, root, "unresolvable link at " + probe);
        }
        if (!real.startsWith(realRoot)) {
            throw new PathViolationException(declared, root, "link at " + probe + " leads outside the root");
        }
    }
}
