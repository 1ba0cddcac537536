package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.Like;
import dev.vibeshowcase.entity.LikeTarget;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Access to {@code likes}. Every statement addresses exactly one target column,
 * chosen from the {@link LikeTarget} discriminant.
 */
public interface LikeRepository {

    /**
     * Inserts the like unless the user already likes that target.
     *
     * @return true if a row was written
     */
    Mono<Boolean> insert(Like like);

    Mono<Boolean> delete(long userId, LikeTarget target);

    Mono<Long> count(LikeTarget target);

    Flux<IdCount> countByTargets(LikeTarget.Type type, Long[] targetIds);

    Flux<Long> findLikedTargetIds(long userId, LikeTarget.Type type, Long[] targetIds);

    /**
     * Removes likes on the project and on its comments and replies.
     */
    Mono<Void> deleteForProject(long projectId);

    /**
     * Removes likes on the comment and on its replies.
     */
    Mono<Void> deleteForComment(long commentId);

    /**
     * Removes likes given by the user and likes on the user's comments and replies.
     */
    Mono<Void> deleteForUser(long userId);
}
