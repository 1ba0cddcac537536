package dev.vibeshowcase.repository;

import reactor.core.publisher.Flux;

/**
 * Batched per-page engagement lookups that are not likes.
 */
public interface ProjectEngagementRepository {

    Flux<IdCount> countComments(Long[] projectIds);

    Flux<Long> findBookmarkedProjectIds(long userId, Long[] projectIds);
}
