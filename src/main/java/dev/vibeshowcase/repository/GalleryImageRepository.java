package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.GalleryImage;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface GalleryImageRepository extends ReactiveCrudRepository<GalleryImage, Long> {

    @Query("SELECT * FROM project_gallery WHERE project_id = :projectId ORDER BY display_order, id")
    Flux<GalleryImage> findByProjectId(Long projectId);

    @Modifying
    @Query("DELETE FROM project_gallery WHERE project_id = :projectId")
    Mono<Integer> deleteByProjectId(Long projectId);
}
