package dev.vibeshowcase.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
@RequiredArgsConstructor
public class ProjectEngagementRepositoryImpl implements ProjectEngagementRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String COMMENT_COUNT_BY_PROJECT_IDS =
            "SELECT project_id, COUNT(*) AS cnt FROM comments WHERE project_id = ANY(:ids) GROUP BY project_id";

    private static final String BOOKMARKED_PROJECT_IDS =
            "SELECT project_id FROM bookmarks WHERE user_id = :userId AND project_id = ANY(:ids)";

    @Override
    public Flux<IdCount> countComments(Long[] projectIds) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(COMMENT_COUNT_BY_PROJECT_IDS)
                .bind("ids", projectIds)
                .map((row, meta) -> new IdCount(
                        row.get("project_id", Long.class),
                        row.get("cnt", Long.class)))
                .all();
    }

    @Override
    public Flux<Long> findBookmarkedProjectIds(long userId, Long[] projectIds) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(BOOKMARKED_PROJECT_IDS)
                .bind("userId", userId)
                .bind("ids", projectIds)
                .map((row, meta) -> row.get("project_id", Long.class))
                .all();
    }
}
