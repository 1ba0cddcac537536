package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.CommentReply;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface CommentReplyRepository extends ReactiveCrudRepository<CommentReply, Long> {

    @Query("SELECT * FROM comment_replies WHERE comment_id = ANY(:commentIds) ORDER BY created_at ASC, id ASC")
    Flux<CommentReply> findByCommentIds(Long[] commentIds);

    @Modifying
    @Query("DELETE FROM comment_replies WHERE comment_id = :commentId")
    Mono<Integer> deleteByCommentId(Long commentId);

    @Modifying
    @Query("DELETE FROM comment_replies WHERE comment_id IN (SELECT id FROM comments WHERE project_id = :projectId)")
    Mono<Integer> deleteByProjectId(Long projectId);

    // the user's own replies and every reply under the user's comments
    @Modifying
    @Query("DELETE FROM comment_replies WHERE author_id = :userId " +
            "OR comment_id IN (SELECT id FROM comments WHERE author_id = :userId)")
    Mono<Integer> deleteByUserId(Long userId);
}
