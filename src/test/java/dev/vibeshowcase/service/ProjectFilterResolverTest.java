package dev.vibeshowcase.service;

import dev.vibeshowcase.entity.Tag;
import dev.vibeshowcase.entity.User;
import dev.vibeshowcase.repository.ProjectFilter;
import dev.vibeshowcase.repository.ProjectRepository;
import dev.vibeshowcase.repository.ProjectSort;
import dev.vibeshowcase.repository.ProjectTagRepository;
import dev.vibeshowcase.repository.TagRepository;
import dev.vibeshowcase.repository.UserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProjectFilterResolverTest {

    @Mock
    private TagRepository tagRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private ProjectTagRepository projectTagRepository;

    @Mock
    private ProjectRepository projectRepository;

    @InjectMocks
    private ProjectFilterResolver resolver;

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("Should only restrict visibility when no filter is given")
        void shouldApplyVisibilityOnly() {
            StepVerifier.create(resolver.resolve(ProjectQuery.of(null, "  ", null, null), 3L))
                    .assertNext(filter -> {
                        assertThat(filter.conditions()).hasSize(1);
                        assertThat(filter.bindings()).containsExactly(entry("viewerId", 3L));
                    })
                    .verifyComplete();

            verify(tagRepository, never()).findByNameIgnoreCase(anyString());
            verify(userRepository, never()).findByUsernameIgnoreCase(anyString());
        }

        @Test
        @DisplayName("Should resolve an existing tag to its id")
        void shouldResolveTag() {
            when(tagRepository.findByNameIgnoreCase("AI Tools"))
                    .thenReturn(Mono.just(Tag.builder().id(11L).name("AI Tools").build()));

            StepVerifier.create(resolver.resolve(ProjectQuery.of(" AI Tools ", null, null, "latest"), 0L))
                    .assertNext(filter -> assertThat(filter.bindings()).containsEntry("tagId", 11L))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should complete empty when the tag does not exist")
        void shouldCompleteEmptyForUnknownTag() {
            when(tagRepository.findByNameIgnoreCase("nope")).thenReturn(Mono.empty());

            StepVerifier.create(resolver.resolve(ProjectQuery.of("nope", null, null, null), 0L))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should complete empty when the author does not exist")
        void shouldCompleteEmptyForUnknownAuthor() {
            when(userRepository.findByUsernameIgnoreCase("ghost")).thenReturn(Mono.empty());

            StepVerifier.create(resolver.resolve(ProjectQuery.of(null, null, "ghost", null), 0L))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should not look up the author once the tag is unknown")
        void shouldShortCircuitAfterUnknownTag() {
            when(tagRepository.findByNameIgnoreCase("nope")).thenReturn(Mono.empty());

            StepVerifier.create(resolver.resolve(ProjectQuery.of("nope", null, "ada", null), 0L))
                    .verifyComplete();

            verify(userRepository, never()).findByUsernameIgnoreCase(anyString());
        }

        @Test
        @DisplayName("Should combine author, search and featured filters")
        void shouldCombineFilters() {
            when(userRepository.findByUsernameIgnoreCase("ada"))
                    .thenReturn(Mono.just(User.builder().id(5L).username("ada").build()));

            StepVerifier.create(resolver.resolve(new ProjectQuery(null, "bot", "ada", ProjectSort.FEATURED), 5L))
                    .assertNext(filter -> {
                        assertThat(filter.bindings())
                                .containsEntry("authorId", 5L)
                                .containsEntry("search", "%bot%");
                        assertThat(filter.whereClause()).contains("p.featured = TRUE");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("resolveAuthorScope")
    class ResolveAuthorScope {

        @Test
        @DisplayName("Should be unrestricted without filters")
        void shouldBeUnrestricted() {
            StepVerifier.create(resolver.resolveAuthorScope(null, ""))
                    .assertNext(scope -> assertThat(scope.restricted()).isFalse())
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should yield an empty scope for an unknown tag")
        void shouldBeEmptyForUnknownTag() {
            when(tagRepository.findByNameIgnoreCase("nope")).thenReturn(Mono.empty());

            StepVerifier.create(resolver.resolveAuthorScope("nope", null))
                    .assertNext(scope -> assertThat(scope.isEmpty()).isTrue())
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should intersect tag and tool authors")
        void shouldIntersectTagAndTool() {
            when(tagRepository.findByNameIgnoreCase("Art"))
                    .thenReturn(Mono.just(Tag.builder().id(2L).name("Art").build()));
            when(projectTagRepository.findAuthorIdsByTagId(2L)).thenReturn(Flux.just(1L, 2L, 3L));
            when(projectRepository.findAuthorIdsByTool("Bolt")).thenReturn(Flux.just(2L, 3L, 4L));

            StepVerifier.create(resolver.resolveAuthorScope("Art", "Bolt"))
                    .assertNext(scope -> {
                        assertThat(scope.restricted()).isTrue();
                        assertThat(scope.authorIds()).containsExactlyInAnyOrder(2L, 3L);
                    })
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("The resolved filter should keep visibility as its first condition")
    void visibilityComesFirst() {
        ProjectFilter filter = resolver.resolve(ProjectQuery.of(null, "x", null, null), 9L).block();

        assertThat(filter).isNotNull();
        assertThat(filter.conditions().get(0)).contains(":viewerId");
    }
}
