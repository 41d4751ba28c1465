package me.internalizable.honeymesh.persona.template;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A login account offered by the persona.
 *
 * @param username login name
 * @param password password accepted by the honeypot
 * @param uid numeric user id
 * @param gid numeric group id
 * @param home home directory inside the emulated filesystem
 * @param shell login shell
 * @param description GECOS field
 */
public record UserAccount(
        @Nonnull String username,
        @Nonnull String password,
        int uid,
        int gid,
        @Nonnull String home,
        @Nonnull String shell,
        @Nonnull String description
) {
    public UserAccount {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(home, "home");
        Objects.requireNonNull(shell, "shell");
        Objects.requireNonNull(description, "description");
    }
}
