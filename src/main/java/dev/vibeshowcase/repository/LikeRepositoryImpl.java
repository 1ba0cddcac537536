package dev.vibeshowcase.repository;

import dev.vibeshowcase.entity.Like;
import dev.vibeshowcase.entity.LikeTarget;
import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
@RequiredArgsConstructor
public class LikeRepositoryImpl implements LikeRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    // %s is always a LikeTarget.Type column name, never user input
    private static final String INSERT =
            "INSERT INTO likes (id, user_id, %s, created_at) VALUES (:id, :userId, :targetId, :createdAt) " +
            "ON CONFLICT DO NOTHING";

    private static final String DELETE =
            "DELETE FROM likes WHERE user_id = :userId AND %s = :targetId";

    private static final String COUNT =
            "SELECT COUNT(*) AS cnt FROM likes WHERE %s = :targetId";

    private static final String COUNT_BY_TARGETS =
            "SELECT %1$s AS target_id, COUNT(*) AS cnt FROM likes WHERE %1$s = ANY(:ids) GROUP BY %1$s";

    private static final String LIKED_TARGET_IDS =
            "SELECT %1$s AS target_id FROM likes WHERE user_id = :userId AND %1$s = ANY(:ids)";

    private static final String DELETE_FOR_PROJECT =
            "DELETE FROM likes WHERE project_id = :projectId " +
            "OR comment_id IN (SELECT id FROM comments WHERE project_id = :projectId) " +
            "OR reply_id IN (SELECT r.id FROM comment_replies r JOIN comments c ON c.id = r.comment_id " +
            "WHERE c.project_id = :projectId)";

    private static final String DELETE_FOR_COMMENT =
            "DELETE FROM likes WHERE comment_id = :commentId " +
            "OR reply_id IN (SELECT id FROM comment_replies WHERE comment_id = :commentId)";

    private static final String DELETE_FOR_USER =
            "DELETE FROM likes WHERE user_id = :userId " +
            "OR comment_id IN (SELECT id FROM comments WHERE author_id = :userId) " +
            "OR reply_id IN (SELECT id FROM comment_replies WHERE author_id = :userId " +
            "OR comment_id IN (SELECT id FROM comments WHERE author_id = :userId))";

    @Override
    public Mono<Boolean> insert(Like like) {
        LikeTarget target = like.target();
        return r2dbcTemplate.getDatabaseClient()
                .sql(INSERT.formatted(target.type().column()))
                .bind("id", like.getId())
                .bind("userId", like.getUserId())
                .bind("targetId", target.id())
                .bind("createdAt", like.getCreatedAt())
                .fetch()
                .rowsUpdated()
                .map(rows -> rows > 0);
    }

    @Override
    public Mono<Boolean> delete(long userId, LikeTarget target) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(DELETE.formatted(target.type().column()))
                .bind("userId", userId)
                .bind("targetId", target.id())
                .fetch()
                .rowsUpdated()
                .map(rows -> rows > 0);
    }

    @Override
    public Mono<Long> count(LikeTarget target) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(COUNT.formatted(target.type().column()))
                .bind("targetId", target.id())
                .map((row, meta) -> row.get("cnt", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    @Override
    public Flux<IdCount> countByTargets(LikeTarget.Type type, Long[] targetIds) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(COUNT_BY_TARGETS.formatted(type.column()))
                .bind("ids", targetIds)
                .map((row, meta) -> new IdCount(
                        row.get("target_id", Long.class),
                        row.get("cnt", Long.class)))
                .all();
    }

    @Override
    public Flux<Long> findLikedTargetIds(long userId, LikeTarget.Type type, Long[] targetIds) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(LIKED_TARGET_IDS.formatted(type.column()))
                .bind("userId", userId)
                .bind("ids", targetIds)
                .map((row, meta) -> row.get("target_id", Long.class))
                .all();
    }

    @Override
    public Mono<Void> deleteForProject(long projectId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(DELETE_FOR_PROJECT)
                .bind("projectId", projectId)
                .fetch()
                .rowsUpdated()
                .then();
    }

    @Override
    public Mono<Void> deleteForComment(long commentId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(DELETE_FOR_COMMENT)
                .bind("commentId", commentId)
                .fetch()
                .rowsUpdated()
                .then();
    }

    @Override
    public Mono<Void> deleteForUser(long userId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(DELETE_FOR_USER)
                .bind("userId", userId)
                .fetch()
                .rowsUpdated()
                .then();
    }
}
