package dev.vibeshowcase.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Things a member did, as stored in {@code user_activity.type}. Each type says what kind of
 * row its target id refers to.
 */
public enum ActivityType {
    PROJECT_CREATED("project_created", Target.PROJECT),
    PROJECT_UPDATED("project_updated", Target.PROJECT),
    PROJECT_DELETED("project_deleted", Target.NONE),
    PROJECT_LIKED("project_liked", Target.PROJECT),
    PROJECT_BOOKMARKED("project_bookmarked", Target.PROJECT),
    PROJECT_SHARED("project_shared", Target.PROJECT),
    COMMENT_CREATED("comment_created", Target.COMMENT),
    REPLY_CREATED("reply_created", Target.REPLY);

    private final String value;
    private final Target target;

    ActivityType(String value, Target target) {
        this.value = value;
        this.target = target;
    }

    public String value() {
        return value;
    }

    public Target target() {
        return target;
    }

    public static Optional<ActivityType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }

    /**
     * {@code NONE} for targets that no longer exist once the activity happened.
     */
    public enum Target {
        PROJECT, COMMENT, REPLY, NONE
    }
}
