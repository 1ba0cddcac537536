package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.Share;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

public interface ShareRepository extends ReactiveCrudRepository<Share, Long> {

    @Modifying
    @Query("DELETE FROM shares WHERE project_id = :projectId")
    Mono<Integer> deleteByProjectId(Long projectId);

    // shares stay counted on the project, only the sharer is forgotten
    @Modifying
    @Query("UPDATE shares SET user_id = NULL WHERE user_id = :userId")
    Mono<Integer> detachUser(Long userId);
}
