package dev.vibeshowcase.entity;

/**
 * What a {@link Like} points at. Exactly one kind of target per like.
 */
public sealed interface LikeTarget permits LikeTarget.ProjectLike, LikeTarget.CommentLike, LikeTarget.ReplyLike {

    long id();

    Type type();

    static LikeTarget project(long projectId) {
        return new ProjectLike(projectId);
    }

    static LikeTarget comment(long commentId) {
        return new CommentLike(commentId);
    }

    static LikeTarget reply(long replyId) {
        return new ReplyLike(replyId);
    }

    record ProjectLike(long id) implements LikeTarget {
        @Override
        public Type type() {
            return Type.PROJECT;
        }
    }

    record CommentLike(long id) implements LikeTarget {
        @Override
        public Type type() {
            return Type.COMMENT;
        }
    }

    record ReplyLike(long id) implements LikeTarget {
        @Override
        public Type type() {
            return Type.REPLY;
        }
    }

    /**
     * Discriminant, carrying the {@code likes} column that holds the target id.
     */
    enum Type {
        PROJECT("project_id", NotificationType.LIKE_PROJECT),
        COMMENT("comment_id", NotificationType.LIKE_COMMENT),
        REPLY("reply_id", NotificationType.LIKE_REPLY);

        private final String column;
        private final NotificationType notificationType;

        Type(String column, NotificationType notificationType) {
            this.column = column;
            this.notificationType = notificationType;
        }

        public String column() {
            return column;
        }

        public NotificationType notificationType() {
            return notificationType;
        }
    }
}
