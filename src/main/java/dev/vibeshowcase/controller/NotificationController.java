package dev.vibeshowcase.controller;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.dto.CountResponse;
import dev.vibeshowcase.dto.MessageResponse;
import dev.vibeshowcase.dto.NotificationPageResponse;
import dev.vibeshowcase.dto.NotificationResponse;
import dev.vibeshowcase.dto.PageParams;
import dev.vibeshowcase.security.CurrentViewer;
import dev.vibeshowcase.service.NotificationEventBus;
import dev.vibeshowcase.service.NotificationService;
import dev.vibeshowcase.util.PathIds;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
@Tag(name = "Notifications", description = "Stored notifications and the live stream")
@Slf4j
public class NotificationController {

    static final int DEFAULT_NOTIFICATION_LIMIT = 20;

    private final NotificationService notificationService;
    private final NotificationEventBus eventBus;
    private final CurrentViewer currentViewer;
    private final ResilienceConfig resilience;

    @GetMapping
    @Operation(summary = "List notifications", description = "Newest first; unreadOnly=true limits to unread ones")
    public Mono<NotificationPageResponse> list(
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String offset,
            @RequestParam(defaultValue = "false") boolean unreadOnly) {
        int size = PageParams.parse(null, limit, DEFAULT_NOTIFICATION_LIMIT).limit();
        long skip = parseOffset(offset);
        return currentViewer.require()
                .flatMap(viewer -> notificationService.list(viewer.id(), size, skip, unreadOnly));
    }

    @GetMapping("/count")
    @Operation(summary = "Unread count", description = "0 for anonymous callers")
    public Mono<CountResponse> count() {
        return currentViewer.get()
                .flatMap(viewer -> viewer.isAnonymous()
                        ? Mono.just(0L)
                        : notificationService.countUnread(viewer.id()))
                .map(CountResponse::new);
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Mark notification read")
    public Mono<MessageResponse> markRead(@PathVariable String id) {
        long notificationId = PathIds.parse(id);
        return currentViewer.require()
                .flatMap(viewer -> notificationService.markRead(viewer.id(), notificationId))
                .thenReturn(MessageResponse.of("Notification marked as read"));
    }

    @PatchMapping
    @Operation(summary = "Mark all notifications read")
    public Mono<MessageResponse> markAllRead() {
        return currentViewer.require()
                .flatMap(viewer -> notificationService.markAllRead(viewer.id()))
                .thenReturn(MessageResponse.of("All notifications marked as read"));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete notification")
    public Mono<MessageResponse> delete(@PathVariable String id) {
        long notificationId = PathIds.parse(id);
        return currentViewer.require()
                .flatMap(viewer -> notificationService.delete(viewer.id(), notificationId))
                .thenReturn(MessageResponse.of("Notification deleted"));
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Live notifications", description = "Server-sent events; a heartbeat comment keeps the stream open")
    public Flux<ServerSentEvent<NotificationResponse>> stream() {
        return currentViewer.require().flatMapMany(viewer -> {
            log.debug("User {} subscribing to notification stream", viewer.id());
            Flux<ServerSentEvent<NotificationResponse>> events = eventBus.subscribe(viewer.id())
                    .map(notification -> ServerSentEvent.<NotificationResponse>builder()
                            .event("notification")
                            .id(String.valueOf(notification.getId()))
                            .data(notification)
                            .build());

            Flux<ServerSentEvent<NotificationResponse>> heartbeat = Flux.interval(resilience.getStreamHeartbeat())
                    .map(i -> ServerSentEvent.<NotificationResponse>builder()
                            .comment("heartbeat")
                            .build());

            return Flux.merge(events, heartbeat);
        });
    }

    private static long parseOffset(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
