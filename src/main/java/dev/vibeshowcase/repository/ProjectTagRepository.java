package dev.vibeshowcase.repository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The {@code project_tags} join table. R2DBC has no join entities, so this is plain SQL.
 */
public interface ProjectTagRepository {

    /**
     * Tag names of the given projects, in the order the tags were attached.
     */
    Flux<TagLink> findTagNames(Long[] projectIds);

    Mono<Void> insert(long id, long projectId, long tagId);

    Mono<Void> deleteByProjectId(long projectId);

    /**
     * Authors with at least one public project carrying the tag.
     */
    Flux<Long> findAuthorIdsByTagId(long tagId);

    Flux<TagCount> findPopular(int limit);
}
