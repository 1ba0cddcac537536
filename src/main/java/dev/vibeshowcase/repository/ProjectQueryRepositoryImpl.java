package dev.vibeshowcase.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Map;

@Repository
@RequiredArgsConstructor
public class ProjectQueryRepositoryImpl implements ProjectQueryRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String PAGE_IDS =
            "SELECT p.id FROM projects p WHERE %s ORDER BY %s LIMIT :limit OFFSET :offset";

    private static final String COUNT =
            "SELECT COUNT(*) AS cnt FROM projects p WHERE %s";

    private static final String TRENDING_CANDIDATES =
            "SELECT p.id, p.created_at, COALESCE(pv.views_count, 0)::bigint AS monthly_views FROM projects p " +
            "LEFT JOIN project_views pv ON pv.project_id = p.id AND pv.month = :month AND pv.year = :year " +
            "WHERE %s ORDER BY " + ProjectSort.TRENDING.orderBy();

    @Override
    public Flux<Long> findPageIds(ProjectFilter filter, ProjectSort sort, int limit, long offset) {
        return bindAll(PAGE_IDS.formatted(filter.whereClause(), sort.orderBy()), filter.bindings())
                .bind("limit", limit)
                .bind("offset", offset)
                .map((row, meta) -> row.get("id", Long.class))
                .all();
    }

    @Override
    public Mono<Long> count(ProjectFilter filter) {
        return bindAll(COUNT.formatted(filter.whereClause()), filter.bindings())
                .map((row, meta) -> row.get("cnt", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    @Override
    public Flux<TrendingCandidate> findTrendingCandidates(ProjectFilter filter, int month, int year) {
        return bindAll(TRENDING_CANDIDATES.formatted(filter.whereClause()), filter.bindings())
                .bind("month", month)
                .bind("year", year)
                .map((row, meta) -> new TrendingCandidate(
                        row.get("id", Long.class),
                        row.get("created_at", LocalDateTime.class),
                        row.get("monthly_views", Long.class)))
                .all();
    }

    private DatabaseClient.GenericExecuteSpec bindAll(String sql, Map<String, Object> bindings) {
        DatabaseClient.GenericExecuteSpec spec = r2dbcTemplate.getDatabaseClient().sql(sql);
        for (Map.Entry<String, Object> binding : bindings.entrySet()) {
            spec = spec.bind(binding.getKey(), binding.getValue());
        }
        return spec;
    }
}
