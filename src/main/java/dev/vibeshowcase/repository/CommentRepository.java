package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.Comment;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface CommentRepository extends ReactiveCrudRepository<Comment, Long> {

    @Query("SELECT * FROM comments WHERE project_id = :projectId " +
            "ORDER BY created_at DESC, id DESC LIMIT :limit OFFSET :offset")
    Flux<Comment> findNewest(Long projectId, int limit, long offset);

    @Query("SELECT * FROM comments WHERE project_id = :projectId " +
            "ORDER BY created_at ASC, id ASC LIMIT :limit OFFSET :offset")
    Flux<Comment> findOldest(Long projectId, int limit, long offset);

    @Query("SELECT c.* FROM comments c WHERE c.project_id = :projectId " +
            "ORDER BY (SELECT COUNT(*) FROM likes l WHERE l.comment_id = c.id) DESC, c.created_at DESC, c.id DESC " +
            "LIMIT :limit OFFSET :offset")
    Flux<Comment> findMostLiked(Long projectId, int limit, long offset);

    Mono<Long> countByProjectId(Long projectId);

    @Query("SELECT * FROM comments ORDER BY created_at DESC LIMIT :limit")
    Flux<Comment> findRecent(int limit);

    @Modifying
    @Query("DELETE FROM comments WHERE project_id = :projectId")
    Mono<Integer> deleteByProjectId(Long projectId);

    @Modifying
    @Query("DELETE FROM comments WHERE author_id = :authorId")
    Mono<Integer> deleteByAuthorId(Long authorId);
}
