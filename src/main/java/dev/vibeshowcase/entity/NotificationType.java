package dev.vibeshowcase.entity;

public enum NotificationType {
    LIKE_PROJECT("like_project"),
    COMMENT_PROJECT("comment_project"),
    REPLY_COMMENT("reply_comment"),
    LIKE_COMMENT("like_comment"),
    LIKE_REPLY("like_reply");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
