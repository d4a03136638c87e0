/* (C)2026 */
package com.ammann.composemanager.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ComposeRuntimeConfig")
class ComposeRuntimeConfigTest {

    @Nested
    @DisplayName("isHidden")
    class IsHidden {

        @Test
        @DisplayName("should return false when no projects are hidden")
        void shouldReturnFalseWhenNothingHidden() {
            ComposeRuntimeConfig config = createConfig(Optional.empty());

            assertThat(config.isHidden("traefik")).isFalse();
        }

        @Test
        @DisplayName("should return false for empty hidden set")
        void shouldReturnFalseForEmptySet() {
            ComposeRuntimeConfig config = createConfig(Optional.of(Set.of()));

            assertThat(config.isHidden("traefik")).isFalse();
        }

        @Test
        @DisplayName("should return true for hidden project")
        void shouldReturnTrueForHiddenProject() {
            ComposeRuntimeConfig config = createConfig(Optional.of(Set.of("traefik", "portainer")));

            assertThat(config.isHidden("portainer")).isTrue();
        }

        @Test
        @DisplayName("should compare project names case-insensitively")
        void shouldIgnoreCase() {
            ComposeRuntimeConfig config = createConfig(Optional.of(Set.of("Traefik")));

            assertThat(config.isHidden("traefik")).isTrue();
            assertThat(config.isHidden("TRAEFIK")).isTrue();
        }

        @Test
        @DisplayName("should return false for null project name")
        void shouldReturnFalseForNull() {
            ComposeRuntimeConfig config = createConfig(Optional.of(Set.of("traefik")));

            assertThat(config.isHidden(null)).isFalse();
        }
    }

    private ComposeRuntimeConfig createConfig(Optional<Set<String>> hiddenProjects) {
        return () -> hiddenProjects;
    }
}
