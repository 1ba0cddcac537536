package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.Bookmark;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

public interface BookmarkRepository extends ReactiveCrudRepository<Bookmark, Long> {

    @Modifying
    @Query("INSERT INTO bookmarks (id, user_id, project_id, created_at) VALUES (:id, :userId, :projectId, :createdAt) " +
            "ON CONFLICT (user_id, project_id) DO NOTHING")
    Mono<Integer> insertIfAbsent(Long id, Long userId, Long projectId, LocalDateTime createdAt);

    @Modifying
    @Query("DELETE FROM bookmarks WHERE user_id = :userId AND project_id = :projectId")
    Mono<Integer> deleteByUserIdAndProjectId(Long userId, Long projectId);

    @Modifying
    @Query("DELETE FROM bookmarks WHERE project_id = :projectId")
    Mono<Integer> deleteByProjectId(Long projectId);

    @Modifying
    @Query("DELETE FROM bookmarks WHERE user_id = :userId")
    Mono<Integer> deleteByUserId(Long userId);
}
