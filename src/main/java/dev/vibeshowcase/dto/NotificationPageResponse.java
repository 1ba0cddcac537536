package dev.vibeshowcase.dto;

import java.util.List;

public record NotificationPageResponse(List<NotificationResponse> notifications, long total) {
}
