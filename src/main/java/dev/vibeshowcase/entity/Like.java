package dev.vibeshowcase.entity;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A row of {@code likes}. The table keeps one nullable column per target kind;
 * instances are only built from a {@link LikeTarget}, so exactly one of them is set.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "id")
public final class Like {

    private final Long id;
    private final Long userId;
    private final Long projectId;
    private final Long commentId;
    private final Long replyId;
    private final LocalDateTime createdAt;

    private Like(Long id, Long userId, Long projectId, Long commentId, Long replyId, LocalDateTime createdAt) {
        this.id = id;
        this.userId = userId;
        this.projectId = projectId;
        this.commentId = commentId;
        this.replyId = replyId;
        this.createdAt = createdAt;
    }

    public static Like of(long id, long userId, LikeTarget target, LocalDateTime createdAt) {
        Objects.requireNonNull(target, "target");
        return new Like(id, userId,
                target.type() == LikeTarget.Type.PROJECT ? target.id() : null,
                target.type() == LikeTarget.Type.COMMENT ? target.id() : null,
                target.type() == LikeTarget.Type.REPLY ? target.id() : null,
                createdAt);
    }

    public LikeTarget target() {
        int targets = (projectId != null ? 1 : 0) + (commentId != null ? 1 : 0) + (replyId != null ? 1 : 0);
        if (targets != 1) {
            throw new IllegalStateException("Like " + id + " references " + targets + " targets, expected exactly one");
        }
        if (projectId != null) {
            return LikeTarget.project(projectId);
        }
        if (commentId != null) {
            return LikeTarget.comment(commentId);
        }
        return LikeTarget.reply(replyId);
    }
}
