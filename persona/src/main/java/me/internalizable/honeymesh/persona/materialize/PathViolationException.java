package me.internalizable.honeymesh.persona.materialize;

import javax.annotation.Nonnull;
import java.nio.file.FileSystemException;
import java.nio.file.Path;

/**
 * Thrown when a declared template path would land outside the materialization root.
 */
public class PathViolationException extends FileSystemException {

    /**
     * @param declaredPath path as written in the template
     * @param root materialization root
     * @param reason what is wrong with the path
     */
    public PathViolationException(@Nonnull String declaredPath, @Nonnull Path root, @Nonnull String reason) {
        super(declaredPath, root.toString(), reason);
    }
}
