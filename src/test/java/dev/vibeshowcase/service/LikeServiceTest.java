package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.entity.ActivityType;
import dev.vibeshowcase.entity.Like;
import dev.vibeshowcase.entity.LikeTarget;
import dev.vibeshowcase.entity.NotificationType;
import dev.vibeshowcase.metrics.ShowcaseMetrics;
import dev.vibeshowcase.repository.LikeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LikeServiceTest {

    @Mock
    private LikeRepository likeRepository;

    @Mock
    private NotificationService notificationService;

    @Mock
    private ActivityService activityService;

    @Mock
    private IdService idService;

    @Mock
    private ShowcaseMetrics metrics;

    private LikeService likeService;

    private final LikeTarget target = LikeTarget.project(7L);
    private final NotificationDraft draft = NotificationDraft.project(9L, 5L, NotificationType.LIKE_PROJECT, 7L);

    @BeforeEach
    void setUp() {
        likeService = new LikeService(likeRepository, notificationService, activityService, idService, metrics,
                new ResilienceConfig(10, 30), Clock.fixed(Instant.parse("2025-03-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should store the like, notify the owner and return the new count")
    void shouldLikeAndNotify() {
        when(idService.nextId()).thenReturn(100L);
        when(likeRepository.insert(any(Like.class))).thenReturn(Mono.just(true));
        when(notificationService.notify(draft)).thenReturn(Mono.empty());
        when(activityService.record(5L, ActivityType.PROJECT_LIKED, 7L)).thenReturn(Mono.empty());
        when(likeRepository.count(target)).thenReturn(Mono.just(3L));

        StepVerifier.create(likeService.like(5L, target, draft))
                .assertNext(response -> {
                    assertThat(response.success()).isTrue();
                    assertThat(response.likesCount()).isEqualTo(3L);
                    assertThat(response.isLiked()).isTrue();
                })
                .verifyComplete();

        ArgumentCaptor<Like> captor = ArgumentCaptor.forClass(Like.class);
        verify(likeRepository).insert(captor.capture());
        assertThat(captor.getValue().getUserId()).isEqualTo(5L);
        assertThat(captor.getValue().getProjectId()).isEqualTo(7L);
        verify(metrics).liked(LikeTarget.Type.PROJECT);
        verify(activityService).record(5L, ActivityType.PROJECT_LIKED, 7L);
    }

    @Test
    @DisplayName("Liking a comment should notify without recording profile activity")
    void shouldNotRecordCommentLikeActivity() {
        LikeTarget comment = LikeTarget.comment(70L);
        NotificationDraft commentDraft = NotificationDraft.comment(9L, 5L, NotificationType.LIKE_COMMENT, 7L, 70L);
        when(idService.nextId()).thenReturn(102L);
        when(likeRepository.insert(any(Like.class))).thenReturn(Mono.just(true));
        when(notificationService.notify(commentDraft)).thenReturn(Mono.empty());
        when(likeRepository.count(comment)).thenReturn(Mono.just(1L));

        StepVerifier.create(likeService.like(5L, comment, commentDraft))
                .assertNext(response -> assertThat(response.isLiked()).isTrue())
                .verifyComplete();

        verify(activityService, never()).record(anyLong(), any(ActivityType.class), anyLong());
    }

    @Test
    @DisplayName("Liking twice should keep one like and not notify again")
    void shouldBeIdempotent() {
        when(idService.nextId()).thenReturn(101L);
        when(likeRepository.insert(any(Like.class))).thenReturn(Mono.just(false));
        when(likeRepository.count(target)).thenReturn(Mono.just(1L));

        StepVerifier.create(likeService.like(5L, target, draft))
                .assertNext(response -> {
                    assertThat(response.likesCount()).isEqualTo(1L);
                    assertThat(response.isLiked()).isTrue();
                })
                .verifyComplete();

        verify(notificationService, never()).notify(any());
        verify(metrics, never()).liked(any());
        verify(activityService, never()).record(anyLong(), any(ActivityType.class), anyLong());
    }

    @Test
    @DisplayName("Unliking something never liked should succeed with the current count")
    void shouldUnlikeIdempotently() {
        when(likeRepository.delete(5L, target)).thenReturn(Mono.just(false));
        when(likeRepository.count(target)).thenReturn(Mono.empty());

        StepVerifier.create(likeService.unlike(5L, target))
                .assertNext(response -> {
                    assertThat(response.likesCount()).isZero();
                    assertThat(response.isLiked()).isFalse();
                })
                .verifyComplete();
    }
}
