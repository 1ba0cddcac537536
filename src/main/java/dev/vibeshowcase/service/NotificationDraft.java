package dev.vibeshowcase.service;

import dev.vibeshowcase.entity.NotificationType;

/**
 * A notification about to be stored: who receives it, who caused it and what it points at.
 */
public record NotificationDraft(long recipientId, long actorId, NotificationType type,
                                Long projectId, Long commentId, Long replyId) {

    public static NotificationDraft project(long recipientId, long actorId, NotificationType type, long projectId) {
        return new NotificationDraft(recipientId, actorId, type, projectId, null, null);
    }

    public static NotificationDraft comment(long recipientId, long actorId, NotificationType type,
                                            long projectId, long commentId) {
        return new NotificationDraft(recipientId, actorId, type, projectId, commentId, null);
    }

    public static NotificationDraft reply(long recipientId, long actorId, NotificationType type,
                                          long projectId, long commentId, long replyId) {
        return new NotificationDraft(recipientId, actorId, type, projectId, commentId, replyId);
    }

    public boolean isSelfNotification() {
        return recipientId == actorId;
    }
}
