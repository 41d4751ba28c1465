package me.internalizable.honeymesh.persona.template;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Host identity presented by the persona.
 *
 * @param hostname emulated hostname
 * @param sshBanner SSH version banner
 * @param timezone timezone id
 */
public record HostConfiguration(@Nonnull String hostname, @Nonnull String sshBanner, @Nonnull String timezone) {

    public HostConfiguration {
        Objects.requireNonNull(hostname, "hostname");
        Objects.requireNonNull(sshBanner, "sshBanner");
        Objects.requireNonNull(timezone, "timezone");
    }
}
