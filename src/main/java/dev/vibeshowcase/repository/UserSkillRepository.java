package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.UserSkill;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

public interface UserSkillRepository extends ReactiveCrudRepository<UserSkill, Long> {

    @Query("SELECT * FROM user_skills WHERE user_id = :userId ORDER BY category, skill")
    Flux<UserSkill> findByUserId(Long userId);

    @Query("SELECT * FROM user_skills WHERE user_id = :userId " +
            "AND LOWER(category) = LOWER(:category) AND LOWER(skill) = LOWER(:skill) LIMIT 1")
    Mono<UserSkill> findExisting(Long userId, String category, String skill);

    // a concurrent add of the same skill leaves one row; read it back with findExisting
    @Modifying
    @Query("INSERT INTO user_skills (id, user_id, category, skill, created_at) " +
            "VALUES (:id, :userId, :category, :skill, :createdAt) ON CONFLICT DO NOTHING")
    Mono<Integer> insertIfAbsent(Long id, Long userId, String category, String skill, LocalDateTime createdAt);

    @Modifying
    @Query("DELETE FROM user_skills WHERE id = :id AND user_id = :userId")
    Mono<Integer> deleteByIdAndUserId(Long id, Long userId);

    @Query("SELECT DISTINCT category FROM user_skills WHERE user_id = :userId ORDER BY category")
    Flux<String> findCategoriesByUserId(Long userId);
}
