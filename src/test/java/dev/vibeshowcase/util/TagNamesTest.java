package dev.vibeshowcase.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TagNamesTest {

    @Nested
    @DisplayName("canonical")
    class Canonical {

        @Test
        @DisplayName("Should map known tags to their display casing")
        void shouldMapKnownTags() {
            assertThat(TagNames.canonical("ai tools")).isEqualTo("AI Tools");
            assertThat(TagNames.canonical("GPT MODELS")).isEqualTo("GPT Models");
            assertThat(TagNames.canonical("  web development ")).isEqualTo("Web Development");
        }

        @Test
        @DisplayName("Should leave unknown tags unchanged")
        void shouldPassThroughUnknownTags() {
            assertThat(TagNames.canonical("rustacean")).isEqualTo("rustacean");
            assertThat(TagNames.canonical("Three.js")).isEqualTo("Three.js");
        }

        @Test
        @DisplayName("Should return null for null")
        void shouldHandleNull() {
            assertThat(TagNames.canonical(null)).isNull();
        }
    }

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        @DisplayName("Should trim, drop blanks and dedupe case-insensitively in input order")
        void shouldCleanInput() {
            List<String> raw = Arrays.asList("  productivity", "Productivity", "", null, "my tag", "MY TAG ", "Art");

            assertThat(TagNames.normalize(raw)).containsExactly("Productivity", "my tag", "Art");
        }

        @Test
        @DisplayName("Should return an empty list for null or empty input")
        void shouldHandleEmptyInput() {
            assertThat(TagNames.normalize(null)).isEmpty();
            assertThat(TagNames.normalize(List.of())).isEmpty();
        }
    }
}
