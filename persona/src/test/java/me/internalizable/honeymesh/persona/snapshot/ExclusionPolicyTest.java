package me.internalizable.honeymesh.persona.snapshot;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExclusionPolicyTest {

    @Test
    void defaultsHideArtifactsAndFingerprints() {
        ExclusionPolicy policy = ExclusionPolicy.defaults();

        assertThat(policy.matches("/root/fs.pickle")).isTrue();
        assertThat(policy.matches("/root/createfs")).isTrue();
        assertThat(policy.matches("/home/admin/data.pickle")).isTrue();
        assertThat(policy.matches("/opt/cowrie")).isTrue();
        assertThat(policy.matches("/etc/cowrie.cfg")).isTrue();
        assertThat(policy.matches("/var/lib/kippo-data")).isTrue();

        assertThat(policy.matches("/etc/passwd")).isFalse();
        assertThat(policy.matches("/home/root/createfs")).isFalse();
    }

    @Test
    void slashPatternsMatchWholePath() {
        ExclusionPolicy policy = ExclusionPolicy.of(List.of("/var/log/*"));

        assertThat(policy.matches("/var/log/syslog")).isTrue();
        assertThat(policy.matches("/var/log")).isFalse();
        assertThat(policy.matches("/srv/var/log/syslog")).isFalse();
    }

    @Test
    void withAddsPatternsWithoutChangingOriginal() {
        ExclusionPolicy base = ExclusionPolicy.of(List.of("*.bak"));
        ExclusionPolicy extended = base.with(List.of("*.swp", "*.bak"));

        assertThat(extended.getPatterns()).containsExactly("*.bak", "*.swp");
        assertThat(base.getPatterns()).containsExactly("*.bak");
        assertThat(base.matches("/tmp/.notes.swp")).isFalse();
        assertThat(extended.matches("/tmp/.notes.swp")).isTrue();
    }

    @Test
    void noneMatchesNothing() {
        assertThat(ExclusionPolicy.none().matches("/root/fs.pickle")).isFalse();
    }

    @Test
    void literalMatchesOnlyItself() {
        ExclusionPolicy policy = ExclusionPolicy.of(List.of(
                ExclusionPolicy.literal("/share/fs[1].json"),
                ExclusionPolicy.literal("/out{.json"),
                ExclusionPolicy.literal("/*")));

        assertThat(policy.matches("/share/fs[1].json")).isTrue();
        assertThat(policy.matches("/share/fs1.json")).isFalse();
        assertThat(policy.matches("/out{.json")).isTrue();
        assertThat(policy.matches("/*")).isTrue();
        assertThat(policy.matches("/etc")).isFalse();
    }

    @Test
    void rejectsInvalidGlob() {
        assertThatThrownBy(() -> ExclusionPolicy.of(List.of("[")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[");
    }
}
