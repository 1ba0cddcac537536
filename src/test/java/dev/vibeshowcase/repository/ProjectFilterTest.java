package dev.vibeshowcase.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ProjectFilterTest {

    @Test
    @DisplayName("Should always start with the visibility rule")
    void shouldAlwaysRestrictVisibility() {
        ProjectFilter filter = ProjectFilter.visibleTo(7L).build();

        assertThat(filter.whereClause()).isEqualTo("(p.is_private = FALSE OR p.author_id = :viewerId)");
        assertThat(filter.bindings()).containsExactly(entry("viewerId", 7L));
    }

    @Test
    @DisplayName("Should combine every condition with AND")
    void shouldCombineConditions() {
        ProjectFilter filter = ProjectFilter.visibleTo(0L)
                .tag(11L)
                .author(22L)
                .search("chat")
                .featuredOnly()
                .build();

        assertThat(filter.conditions()).hasSize(5);
        assertThat(filter.whereClause())
                .contains(" AND p.author_id = :authorId")
                .contains("pt.tag_id = :tagId")
                .contains("p.title ILIKE :search OR p.description ILIKE :search")
                .endsWith("p.featured = TRUE");
        assertThat(filter.bindings()).containsOnly(
                entry("viewerId", 0L),
                entry("tagId", 11L),
                entry("authorId", 22L),
                entry("search", "%chat%"));
    }

    @Test
    @DisplayName("Built filters should not change when the builder is reused")
    void shouldBeImmutable() {
        ProjectFilter.Builder builder = ProjectFilter.visibleTo(1L);
        ProjectFilter first = builder.build();

        builder.featuredOnly();

        assertThat(first.conditions()).hasSize(1);
        assertThat(builder.build().conditions()).hasSize(2);
    }

    @Nested
    @DisplayName("escapeLike")
    class EscapeLike {

        @Test
        @DisplayName("Should escape LIKE wildcards")
        void shouldEscapeWildcards() {
            assertThat(ProjectFilter.Builder.escapeLike("100%_done")).isEqualTo("100\\%\\_done");
        }

        @Test
        @DisplayName("Should escape the escape character first")
        void shouldEscapeBackslash() {
            assertThat(ProjectFilter.Builder.escapeLike("a\\%")).isEqualTo("a\\\\\\%");
        }

        @Test
        @DisplayName("Should leave plain text untouched")
        void shouldKeepPlainText() {
            assertThat(ProjectFilter.Builder.escapeLike("Prompt Studio")).isEqualTo("Prompt Studio");
        }
    }
}
