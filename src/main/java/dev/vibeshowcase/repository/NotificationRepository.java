package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.Notification;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface NotificationRepository extends ReactiveCrudRepository<Notification, Long> {

    @Query("SELECT * FROM notifications WHERE user_id = :userId " +
            "ORDER BY created_at DESC, id DESC LIMIT :limit OFFSET :offset")
    Flux<Notification> findByUserId(Long userId, int limit, long offset);

    @Query("SELECT * FROM notifications WHERE user_id = :userId AND read = FALSE " +
            "ORDER BY created_at DESC, id DESC LIMIT :limit OFFSET :offset")
    Flux<Notification> findUnreadByUserId(Long userId, int limit, long offset);

    Mono<Long> countByUserId(Long userId);

    @Query("SELECT COUNT(*) FROM notifications WHERE user_id = :userId AND read = FALSE")
    Mono<Long> countUnreadByUserId(Long userId);

    @Modifying
    @Query("UPDATE notifications SET read = TRUE WHERE id = :id AND user_id = :userId")
    Mono<Integer> markRead(Long id, Long userId);

    @Modifying
    @Query("UPDATE notifications SET read = TRUE WHERE user_id = :userId AND read = FALSE")
    Mono<Integer> markAllRead(Long userId);

    @Modifying
    @Query("DELETE FROM notifications WHERE id = :id AND user_id = :userId")
    Mono<Integer> deleteByIdAndUserId(Long id, Long userId);

    @Modifying
    @Query("DELETE FROM notifications WHERE project_id = :projectId")
    Mono<Integer> deleteByProjectId(Long projectId);

    @Modifying
    @Query("DELETE FROM notifications WHERE comment_id = :commentId " +
            "OR reply_id IN (SELECT id FROM comment_replies WHERE comment_id = :commentId)")
    Mono<Integer> deleteByCommentId(Long commentId);

    @Modifying
    @Query("DELETE FROM notifications WHERE user_id = :userId OR actor_id = :userId " +
            "OR comment_id IN (SELECT id FROM comments WHERE author_id = :userId) " +
            "OR reply_id IN (SELECT id FROM comment_replies WHERE author_id = :userId " +
            "OR comment_id IN (SELECT id FROM comments WHERE author_id = :userId))")
    Mono<Integer> deleteByUserId(Long userId);
}
