package me.internalizable.honeymesh.persona.template;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Free-form identification of a template.
 */
public record PersonaMetadata(
        @Nonnull String name,
        @Nonnull String description,
        @Nonnull String category,
        @Nonnull String version,
        @Nonnull String author
) {
    public PersonaMetadata {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(author, "author");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Template name must not be blank");
        }
    }
}
