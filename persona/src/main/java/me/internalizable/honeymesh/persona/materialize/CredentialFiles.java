package me.internalizable.honeymesh.persona.materialize;

import me.internalizable.honeymesh.persona.template.TemplateDefinition;
import me.internalizable.honeymesh.persona.template.UserAccount;

import javax.annotation.Nonnull;

/**
 * Renders the account files generated from a template's users.
 */
public final class CredentialFiles {

    static final String ROOT_PASSWD_LINE = "root:x:0:0:root:/root:/bin/bash";

    private CredentialFiles() {
    }

    /**
     * Render {@code /etc/passwd}. A fixed root account comes first unless the
     * template declares its own {@code root} user.
     *
     * @param template source template
     * @return file content, one line per account
     */
    @Nonnull
    public static String passwd(@Nonnull TemplateDefinition template) {
        StringBuilder builder = new StringBuilder();
        if (!template.getUsers().containsKey("root")) {
            builder.append(ROOT_PASSWD_LINE).append('\n');
        }
        for (UserAccount user : template.getUsers().values()) {
            builder.append(user.username()).append(":x:")
                    .append(user.uid()).append(':')
                    .append(user.gid()).append(':')
                    .append(user.description()).append(':')
                    .append(user.home()).append(':')
                    .append(user.shell()).append('\n');
        }
        return builder.toString();
    }

    /**
     * Render the honeypot's credential database: {@code username:x:password}
     * per account, in declaration order.
     *
     * @param template source template
     * @return file content
     */
    @Nonnull
    public static String userdb(@Nonnull TemplateDefinition template) {
        StringBuilder builder = new StringBuilder();
        for (UserAccount user : template.getUsers().values()) {
            builder.append(user.username()).append(":x:").append(user.password()).append('\n');
        }
        return builder.toString();
    }
}
