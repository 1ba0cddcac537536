package dev.vibeshowcase.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
@RequiredArgsConstructor
public class ProjectViewRepositoryImpl implements ProjectViewRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String UPSERT_MONTHLY =
            "INSERT INTO project_views (id, project_id, views_count, month, year, created_at, updated_at) " +
            "VALUES (:id, :projectId, 1, :month, :year, :now, :now) " +
            "ON CONFLICT (project_id, month, year) " +
            "DO UPDATE SET views_count = project_views.views_count + 1, updated_at = EXCLUDED.updated_at";

    private static final String DELETE_BY_PROJECT_ID =
            "DELETE FROM project_views WHERE project_id = :projectId";

    @Override
    public Mono<Void> incrementMonthly(long rowId, long projectId, int month, int year, LocalDateTime now) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(UPSERT_MONTHLY)
                .bind("id", rowId)
                .bind("projectId", projectId)
                .bind("month", month)
                .bind("year", year)
                .bind("now", now)
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
}
