package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.UserActivity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface UserActivityRepository extends ReactiveCrudRepository<UserActivity, Long> {

    @Query("SELECT * FROM user_activity WHERE user_id = :userId ORDER BY created_at DESC, id DESC LIMIT :limit")
    Flux<UserActivity> findRecentByUserId(Long userId, int limit);
}
