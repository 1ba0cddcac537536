package dev.vibeshowcase.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
@RequiredArgsConstructor
public class ProjectTagRepositoryImpl implements ProjectTagRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String FIND_TAG_NAMES =
            "SELECT pt.project_id, t.name FROM project_tags pt JOIN tags t ON t.id = pt.tag_id " +
            "WHERE pt.project_id = ANY(:ids) ORDER BY pt.id";

    private static final String INSERT =
            "INSERT INTO project_tags (id, project_id, tag_id) VALUES (:id, :projectId, :tagId) " +
            "ON CONFLICT (project_id, tag_id) DO NOTHING";

    private static final String DELETE_BY_PROJECT_ID =
            "DELETE FROM project_tags WHERE project_id = :projectId";

    private static final String AUTHOR_IDS_BY_TAG =
            "SELECT DISTINCT p.author_id FROM projects p JOIN project_tags pt ON pt.project_id = p.id " +
            "WHERE pt.tag_id = :tagId AND p.is_private = FALSE";

    private static final String POPULAR =
            "SELECT t.name, COUNT(pt.project_id) AS cnt FROM tags t JOIN project_tags pt ON pt.tag_id = t.id " +
            "GROUP BY t.id, t.name ORDER BY cnt DESC, t.name LIMIT :limit";

    @Override
    public Flux<TagLink> findTagNames(Long[] projectIds) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(FIND_TAG_NAMES)
                .bind("ids", projectIds)
                .map((row, meta) -> new TagLink(
                        row.get("project_id", Long.class),
                        row.get("name", String.class)))
                .all();
    }

    @Override
    public Mono<Void> insert(long id, long projectId, long tagId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(INSERT)
                .bind("id", id)
                .bind("projectId", projectId)
                .bind("tagId", tagId)
                .fetch()
                .rowsUpdated()
                .then();
    }

    @Override
    public Mono<Void> deleteByProjectId(long projectId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(DELETE_BY_PROJECT_ID)
                .bind("projectId", projectId)
                .fetch()
                .rowsUpdated()
                .then();
    }

    @Override
    public Flux<Long> findAuthorIdsByTagId(long tagId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(AUTHOR_IDS_BY_TAG)
                .bind("tagId", tagId)
                .map((row, meta) -> row.get("author_id", Long.class))
                .all();
    }

    @Override
    public Flux<TagCount> findPopular(int limit) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(POPULAR)
                .bind("limit", limit)
                .map((row, meta) -> new TagCount(
                        row.get("name", String.class),
                        row.get("cnt", Long.class)))
                .all();
    }
}
