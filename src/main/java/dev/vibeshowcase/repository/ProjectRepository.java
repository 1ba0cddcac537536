package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.Project;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

public interface ProjectRepository extends ReactiveCrudRepository<Project, Long> {

    @Query("SELECT * FROM projects WHERE featured = TRUE AND (is_private = FALSE OR author_id = :viewerId) " +
            "ORDER BY created_at DESC, id DESC LIMIT 1")
    Mono<Project> findLatestFeatured(long viewerId);

    @Query("SELECT * FROM projects WHERE author_id = :authorId AND (is_private = FALSE OR author_id = :viewerId) " +
            "ORDER BY created_at DESC, id DESC LIMIT :limit")
    Flux<Project> findByAuthorVisibleTo(Long authorId, long viewerId, int limit);

    @Query("SELECT p.* FROM projects p JOIN likes l ON l.project_id = p.id " +
            "WHERE l.user_id = :userId AND (p.is_private = FALSE OR p.author_id = :userId) " +
            "ORDER BY l.created_at DESC")
    Flux<Project> findLikedBy(Long userId);

    @Query("SELECT p.* FROM projects p JOIN bookmarks b ON b.project_id = p.id " +
            "WHERE b.user_id = :userId AND (p.is_private = FALSE OR p.author_id = :userId) " +
            "ORDER BY b.created_at DESC")
    Flux<Project> findBookmarkedBy(Long userId);

    @Query("SELECT * FROM projects ORDER BY created_at DESC")
    Flux<Project> findAllNewestFirst();

    @Query("SELECT id FROM projects WHERE author_id = :authorId")
    Flux<Long> findIdsByAuthorId(Long authorId);

    @Query("SELECT DISTINCT author_id FROM projects " +
            "WHERE LOWER(vibe_coding_tool) = LOWER(:tool) AND is_private = FALSE")
    Flux<Long> findAuthorIdsByTool(String tool);

    @Modifying
    @Query("UPDATE projects SET views_count = views_count + 1 WHERE id = :id")
    Mono<Integer> incrementViews(Long id);

    @Modifying
    @Query("UPDATE projects SET shares_count = shares_count + 1 WHERE id = :id")
    Mono<Integer> incrementShares(Long id);

    @Query("SELECT shares_count FROM projects WHERE id = :id")
    Mono<Integer> findSharesCount(Long id);

    @Modifying
    @Query("UPDATE projects SET featured = FALSE, updated_at = :now WHERE featured = TRUE AND id <> :keepId")
    Mono<Integer> unfeatureAllExcept(Long keepId, LocalDateTime now);

    @Modifying
    @Query("UPDATE projects SET featured = :featured, updated_at = :now WHERE id = :id")
    Mono<Integer> updateFeatured(Long id, boolean featured, LocalDateTime now);
}
