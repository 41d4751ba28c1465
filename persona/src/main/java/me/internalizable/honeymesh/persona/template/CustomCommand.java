package me.internalizable.honeymesh.persona.template;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A scripted command installed into the persona.
 *
 * @param name command name
 * @param path rooted install path
 * @param content script body
 */
public record CustomCommand(@Nonnull String name, @Nonnull String path, @Nonnull String content) {

    public CustomCommand {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
    }
}
