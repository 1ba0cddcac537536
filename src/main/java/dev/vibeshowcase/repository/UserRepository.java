package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.User;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface UserRepository extends ReactiveCrudRepository<User, Long> {

    @Query("SELECT * FROM users WHERE LOWER(username) = LOWER(:username) LIMIT 1")
    Mono<User> findByUsernameIgnoreCase(String username);

    @Query("SELECT * FROM users WHERE LOWER(email) = LOWER(:email) LIMIT 1")
    Mono<User> findByEmailIgnoreCase(String email);

    @Query("SELECT * FROM users ORDER BY username")
    Flux<User> findAllOrderByUsername();

    @Query("SELECT * FROM users WHERE id = ANY(:ids) ORDER BY username")
    Flux<User> findAllByIdsOrderByUsername(Long[] ids);

    @Query("SELECT * FROM users ORDER BY created_at DESC")
    Flux<User> findAllNewestFirst();

    @Modifying
    @Query("UPDATE users SET role = :role WHERE id = :id")
    Mono<Integer> updateRole(Long id, String role);
}
