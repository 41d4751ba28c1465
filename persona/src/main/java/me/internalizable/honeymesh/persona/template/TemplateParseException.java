package me.internalizable.honeymesh.persona.template;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * Thrown when a template definition is malformed or violates the template schema.
 */
public class TemplateParseException extends IOException {

    private final String templateId;

    public TemplateParseException(@Nonnull String templateId, @Nonnull String message) {
        super("Template '" + templateId + "': " + message);
        this.templateId = templateId;
    }

    public TemplateParseException(@Nonnull String templateId, @Nonnull String message, Throwable cause) {
        super("Template '" + templateId + "': " + message, cause);
        this.templateId = templateId;
    }

    /**
     * Get the id of the template that failed to parse.
     *
     * @return template id
     */
    @Nonnull
    public String getTemplateId() {
        return templateId;
    }
}
