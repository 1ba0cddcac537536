package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.CodingTool;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface CodingToolRepository extends ReactiveCrudRepository<CodingTool, Long> {

    @Query("SELECT * FROM coding_tools ORDER BY name")
    Flux<CodingTool> findAllOrderByName();

    @Query("SELECT * FROM coding_tools WHERE is_popular = TRUE ORDER BY name LIMIT :limit")
    Flux<CodingTool> findPopular(int limit);
}
