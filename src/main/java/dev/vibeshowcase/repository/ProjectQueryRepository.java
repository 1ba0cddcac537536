package dev.vibeshowcase.repository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Dynamic listing queries over {@code projects}. Returns ids only; rows are loaded
 * through {@link ProjectRepository} so entity callbacks apply.
 */
public interface ProjectQueryRepository {

    Flux<Long> findPageIds(ProjectFilter filter, ProjectSort sort, int limit, long offset);

    Mono<Long> count(ProjectFilter filter);

    /**
     * All projects matching the filter with their view count for the given month,
     * newest first.
     */
    Flux<TrendingCandidate> findTrendingCandidates(ProjectFilter filter, int month, int year);
}
