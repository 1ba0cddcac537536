package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.Tag;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface TagRepository extends ReactiveCrudRepository<Tag, Long> {

    @Query("SELECT * FROM tags WHERE LOWER(name) = LOWER(:name) LIMIT 1")
    Mono<Tag> findByNameIgnoreCase(String name);

    @Query("SELECT * FROM tags ORDER BY name")
    Flux<Tag> findAllOrderByName();

    // concurrent creators of the same name both succeed; read the winner back by name
    @Modifying
    @Query("INSERT INTO tags (id, name) VALUES (:id, :name) ON CONFLICT DO NOTHING")
    Mono<Integer> insertIfAbsent(Long id, String name);
}
