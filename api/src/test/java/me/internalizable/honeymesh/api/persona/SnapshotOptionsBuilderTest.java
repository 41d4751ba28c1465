package me.internalizable.honeymesh.api.persona;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotOptionsBuilderTest {

    @Test
    void defaultsUseConfiguredDepthAndExclusions() {
        PersonaAPI.SnapshotOptions options = PersonaAPI.SnapshotOptions.defaults();

        assertThat(options.getMaxDepth()).isEqualTo(-1);
        assertThat(options.getExclusions()).isEmpty();
        assertThat(options.isDefaultExclusions()).isTrue();
    }

    @Test
    void collectsExclusionsInOrder() {
        PersonaAPI.SnapshotOptions options = PersonaAPI.SnapshotOptions.builder()
                .maxDepth(3)
                .exclude("*.bak")
                .exclude(List.of("/tmp/*", "*.swp"))
                .defaultExclusions(false)
                .build();

        assertThat(options.getMaxDepth()).isEqualTo(3);
        assertThat(options.getExclusions()).containsExactly("*.bak", "/tmp/*", "*.swp");
        assertThat(options.isDefaultExclusions()).isFalse();
        assertThatThrownBy(() -> options.getExclusions().add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsInvalidValues() {
        PersonaAPI.SnapshotOptions.Builder builder = PersonaAPI.SnapshotOptions.builder();

        assertThatThrownBy(() -> builder.maxDepth(-2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.exclude(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.exclude((String) null)).isInstanceOf(NullPointerException.class);
    }
}
