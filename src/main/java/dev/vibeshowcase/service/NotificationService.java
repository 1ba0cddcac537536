package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.dto.NotificationPageResponse;
import dev.vibeshowcase.dto.NotificationResponse;
import dev.vibeshowcase.entity.Notification;
import dev.vibeshowcase.entity.Project;
import dev.vibeshowcase.entity.User;
import dev.vibeshowcase.exception.ResourceNotFoundException;
import dev.vibeshowcase.metrics.ShowcaseMetrics;
import dev.vibeshowcase.repository.NotificationRepository;
import dev.vibeshowcase.repository.ProjectRepository;
import dev.vibeshowcase.repository.UserRepository;
import dev.vibeshowcase.util.DateTimes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stores notifications and pushes them to the recipient's open streams.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final UserRepository userRepository;
    private final ProjectRepository projectRepository;
    private final NotificationEventBus eventBus;
    private final IdService idService;
    private final ShowcaseMetrics metrics;
    private final ResilienceConfig resilience;
    private final Clock clock;

    /**
     * Stores the notification, then pushes it live when the recipient is connected.
     * Users are never notified about their own actions.
     */
    public Mono<Void> notify(NotificationDraft draft) {
        if (draft.isSelfNotification()) {
            return Mono.empty();
        }
        Notification notification = Notification.builder()
                .id(idService.nextId())
                .userId(draft.recipientId())
                .type(draft.type().value())
                .actorId(draft.actorId())
                .projectId(draft.projectId())
                .commentId(draft.commentId())
                .replyId(draft.replyId())
                .createdAt(LocalDateTime.now(clock))
                .build();

        return notificationRepository.save(notification)
                .doOnNext(saved -> {
                    metrics.notificationStored();
                    log.debug("Notification {} ({}) stored for user {}", saved.getId(), saved.getType(), saved.getUserId());
                })
                .flatMap(saved -> eventBus.isConnected(saved.getUserId())
                        ? toResponses(List.of(saved)).doOnNext(responses -> push(saved.getUserId(), responses.get(0)))
                        : Mono.just(List.<NotificationResponse>of()))
                .timeout(resilience.getDatabaseTimeout())
                .then();
    }

    public Mono<NotificationPageResponse> list(long userId, int limit, long offset, boolean unreadOnly) {
        Flux<Notification> page = unreadOnly
                ? notificationRepository.findUnreadByUserId(userId, limit, offset)
                : notificationRepository.findByUserId(userId, limit, offset);
        Mono<Long> total = unreadOnly
                ? notificationRepository.countUnreadByUserId(userId)
                : notificationRepository.countByUserId(userId);

        return page.collectList()
                .flatMap(this::toResponses)
                .zipWith(total)
                .map(tuple -> new NotificationPageResponse(tuple.getT1(), tuple.getT2()))
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<Long> countUnread(long userId) {
        return notificationRepository.countUnreadByUserId(userId)
                .defaultIfEmpty(0L)
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<Void> markRead(long userId, long notificationId) {
        return notificationRepository.markRead(notificationId, userId)
                .flatMap(updated -> updated == 0
                        ? Mono.<Void>error(new ResourceNotFoundException("error.notification_not_found"))
                        : Mono.<Void>empty())
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<Integer> markAllRead(long userId) {
        return notificationRepository.markAllRead(userId)
                .doOnNext(updated -> log.debug("Marked {} notifications read for user {}", updated, userId))
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<Void> delete(long userId, long notificationId) {
        return notificationRepository.deleteByIdAndUserId(notificationId, userId)
                .flatMap(deleted -> deleted == 0
                        ? Mono.<Void>error(new ResourceNotFoundException("error.notification_not_found"))
                        : Mono.<Void>empty())
                .timeout(resilience.getDatabaseTimeout());
    }

    private void push(long userId, NotificationResponse response) {
        if (eventBus.publish(userId, response)) {
            metrics.notificationPushed();
        }
    }

    private Mono<List<NotificationResponse>> toResponses(List<Notification> notifications) {
        if (notifications.isEmpty()) {
            return Mono.just(List.of());
        }
        Set<Long> actorIds = notifications.stream()
                .map(Notification::getActorId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Set<Long> projectIds = notifications.stream()
                .map(Notification::getProjectId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        Mono<Map<Long, User>> actors = actorIds.isEmpty()
                ? Mono.just(Map.of())
                : userRepository.findAllById(actorIds).collectMap(User::getId);
        Mono<Map<Long, String>> titles = projectIds.isEmpty()
                ? Mono.just(Map.of())
                : projectRepository.findAllById(projectIds).collectMap(Project::getId, Project::getTitle);

        return Mono.zip(actors, titles).map(tuple -> notifications.stream()
                .map(n -> NotificationResponse.builder()
                        .id(n.getId())
                        .type(n.getType())
                        .read(n.getRead())
                        .actor(n.getActorId() != null ? ProjectEnrichmentService.authorInfo(tuple.getT1().get(n.getActorId())) : null)
                        .projectId(n.getProjectId())
                        .projectTitle(n.getProjectId() != null ? tuple.getT2().get(n.getProjectId()) : null)
                        .commentId(n.getCommentId())
                        .replyId(n.getReplyId())
                        .createdAt(DateTimes.toInstant(n.getCreatedAt()))
                        .build())
                .collect(Collectors.toList()));
    }
}
