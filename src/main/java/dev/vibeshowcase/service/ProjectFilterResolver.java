package dev.vibeshowcase.service;

import dev.vibeshowcase.repository.ProjectFilter;
import dev.vibeshowcase.repository.ProjectRepository;
import dev.vibeshowcase.repository.ProjectSort;
import dev.vibeshowcase.repository.ProjectTagRepository;
import dev.vibeshowcase.repository.TagRepository;
import dev.vibeshowcase.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

/**
 * Turns listing filters into SQL predicates.
 *
 * <p>Named targets (a tag, an author) are looked up first. When one does not exist the
 * returned {@link Mono} completes empty, meaning "nothing can match"; callers answer with an
 * empty page rather than ignoring the filter.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProjectFilterResolver {

    private final TagRepository tagRepository;
    private final UserRepository userRepository;
    private final ProjectTagRepository projectTagRepository;
    private final ProjectRepository projectRepository;

    public Mono<ProjectFilter> resolve(ProjectQuery query, long viewerId) {
        ProjectFilter.Builder builder = ProjectFilter.visibleTo(viewerId);
        if (StringUtils.hasText(query.search())) {
            builder.search(query.search().trim());
        }
        if (query.sort() == ProjectSort.FEATURED) {
            builder.featuredOnly();
        }

        Mono<ProjectFilter.Builder> resolved = Mono.just(builder);
        if (StringUtils.hasText(query.tag())) {
            String tag = query.tag().trim();
            resolved = resolved.flatMap(b -> tagRepository.findByNameIgnoreCase(tag)
                    .map(found -> b.tag(found.getId()))
                    .switchIfEmpty(Mono.fromRunnable(() -> log.debug("Tag '{}' does not exist", tag))));
        }
        if (StringUtils.hasText(query.authorUsername())) {
            String username = query.authorUsername().trim();
            resolved = resolved.flatMap(b -> userRepository.findByUsernameIgnoreCase(username)
                    .map(user -> b.author(user.getId()))
                    .switchIfEmpty(Mono.fromRunnable(() -> log.debug("User '{}' does not exist", username))));
        }
        return resolved.map(ProjectFilter.Builder::build);
    }

    /**
     * Resolves the profile-directory filters. Tag and coding tool each narrow the authors
     * independently; when both are given only authors matching both remain.
     */
    public Mono<AuthorScope> resolveAuthorScope(String tag, String tool) {
        Mono<AuthorScope> byTag = StringUtils.hasText(tag)
                ? tagRepository.findByNameIgnoreCase(tag.trim())
                        .flatMapMany(found -> projectTagRepository.findAuthorIdsByTagId(found.getId()))
                        .collect(Collectors.toSet())
                        .map(AuthorScope::only)
                : Mono.just(AuthorScope.unrestricted());

        Mono<AuthorScope> byTool = StringUtils.hasText(tool)
                ? projectRepository.findAuthorIdsByTool(tool.trim())
                        .collect(Collectors.toSet())
                        .map(AuthorScope::only)
                : Mono.just(AuthorScope.unrestricted());

        return Mono.zip(byTag, byTool).map(scopes -> scopes.getT1().intersect(scopes.getT2()));
    }
}
