package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.dto.LikeResponse;
import dev.vibeshowcase.entity.ActivityType;
import dev.vibeshowcase.entity.Like;
import dev.vibeshowcase.entity.LikeTarget;
import dev.vibeshowcase.metrics.ShowcaseMetrics;
import dev.vibeshowcase.repository.LikeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Likes on projects, comments and replies. Liking twice or unliking something never liked
 * is not an error; the response always carries the current count.
 * Callers check that the target exists and is visible before getting here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LikeService {

    private final LikeRepository likeRepository;
    private final NotificationService notificationService;
    private final ActivityService activityService;
    private final IdService idService;
    private final ShowcaseMetrics metrics;
    private final ResilienceConfig resilience;
    private final Clock clock;

    /**
     * @param notification sent only when this call created the like
     */
    public Mono<LikeResponse> like(long userId, LikeTarget target, NotificationDraft notification) {
        Like like = Like.of(idService.nextId(), userId, target, LocalDateTime.now(clock));
        return likeRepository.insert(like)
                .flatMap(inserted -> {
                    if (!inserted) {
                        log.debug("User {} already likes {}", userId, target);
                        return Mono.<Void>empty();
                    }
                    metrics.liked(target.type());
                    return notificationService.notify(notification)
                            .then(recordActivity(userId, target));
                })
                .then(Mono.defer(() -> currentState(target, true)))
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<LikeResponse> unlike(long userId, LikeTarget target) {
        return likeRepository.delete(userId, target)
                .doOnNext(deleted -> log.debug("User {} unliked {}: removed={}", userId, target, deleted))
                .then(Mono.defer(() -> currentState(target, false)))
                .timeout(resilience.getDatabaseTimeout());
    }

    private Mono<Void> recordActivity(long userId, LikeTarget target) {
        return target.type() == LikeTarget.Type.PROJECT
                ? activityService.record(userId, ActivityType.PROJECT_LIKED, target.id())
                : Mono.empty();
    }

    private Mono<LikeResponse> currentState(LikeTarget target, boolean liked) {
        return likeRepository.count(target)
                .defaultIfEmpty(0L)
                .map(count -> new LikeResponse(true, count, liked));
    }
}
