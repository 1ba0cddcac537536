package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.dto.ActivityResponse;
import dev.vibeshowcase.entity.ActivityType;
import dev.vibeshowcase.entity.Comment;
import dev.vibeshowcase.entity.CommentReply;
import dev.vibeshowcase.entity.Project;
import dev.vibeshowcase.entity.UserActivity;
import dev.vibeshowcase.repository.CommentReplyRepository;
import dev.vibeshowcase.repository.CommentRepository;
import dev.vibeshowcase.repository.ProjectRepository;
import dev.vibeshowcase.repository.UserActivityRepository;
import dev.vibeshowcase.security.Viewer;
import dev.vibeshowcase.util.DateTimes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Member activity feed.
 *
 * <p>Recording joins the caller's unit of work, inside its transaction where it has one.
 * Reading resolves all targets of a page in three batched lookups (replies, then the comments
 * they and the comment activities point at, then the projects behind all of them). Activities
 * whose project the viewer may not see are left out; activities whose target is gone are kept
 * without target data.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityService {

    static final int DEFAULT_LIMIT = 10;
    static final int MAX_LIMIT = 50;

    private final UserActivityRepository activityRepository;
    private final ProjectRepository projectRepository;
    private final CommentRepository commentRepository;
    private final CommentReplyRepository replyRepository;
    private final IdService idService;
    private final ResilienceConfig resilience;
    private final Clock clock;

    public Mono<Void> record(long userId, ActivityType type, long targetId) {
        if (userId == Viewer.ANONYMOUS_ID) {
            return Mono.empty();
        }
        return Mono.defer(() -> activityRepository.save(UserActivity.builder()
                        .id(idService.nextId())
                        .userId(userId)
                        .type(type.value())
                        .targetId(targetId)
                        .createdAt(LocalDateTime.now(clock))
                        .build()))
                .doOnNext(saved -> log.debug("Activity {} recorded for user {} on {}", type.value(), userId, targetId))
                .then();
    }

    /**
     * Most recent activities of a user, newest first. The limit is capped at 50; anything
     * below 1 means the default of 10.
     */
    public Mono<List<ActivityResponse>> getActivities(long userId, int limit, Viewer viewer) {
        int effectiveLimit = limit < 1 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        return activityRepository.findRecentByUserId(userId, effectiveLimit)
                .collectList()
                .flatMap(activities -> activities.isEmpty()
                        ? Mono.just(List.<ActivityResponse>of())
                        : resolveTargets(activities).map(targets -> toResponses(activities, targets, viewer)))
                .timeout(resilience.getDatabaseTimeout());
    }

    private Mono<Targets> resolveTargets(List<UserActivity> activities) {
        return load(targetIds(activities, ActivityType.Target.REPLY), replyRepository::findAllById, CommentReply::getId)
                .flatMap(replies -> {
                    Set<Long> commentIds = targetIds(activities, ActivityType.Target.COMMENT);
                    replies.values().forEach(reply -> commentIds.add(reply.getCommentId()));
                    return load(commentIds, commentRepository::findAllById, Comment::getId)
                            .flatMap(comments -> {
                                Set<Long> projectIds = targetIds(activities, ActivityType.Target.PROJECT);
                                comments.values().forEach(comment -> projectIds.add(comment.getProjectId()));
                                return load(projectIds, projectRepository::findAllById, Project::getId)
                                        .map(projects -> new Targets(projects, comments, replies));
                            });
                });
    }

    private static <T> Mono<Map<Long, T>> load(Set<Long> ids,
                                               Function<Iterable<Long>, Flux<T>> finder,
                                               Function<T, Long> idOf) {
        if (ids.isEmpty()) {
            return Mono.just(Map.of());
        }
        return finder.apply(ids).collectMap(idOf);
    }

    private static Set<Long> targetIds(List<UserActivity> activities, ActivityType.Target target) {
        Set<Long> ids = new HashSet<>();
        for (UserActivity activity : activities) {
            ActivityType.fromValue(activity.getType())
                    .filter(type -> type.target() == target)
                    .ifPresent(type -> ids.add(activity.getTargetId()));
        }
        return ids;
    }

    private List<ActivityResponse> toResponses(List<UserActivity> activities, Targets targets, Viewer viewer) {
        List<ActivityResponse> responses = new ArrayList<>(activities.size());
        for (UserActivity activity : activities) {
            ActivityType.Target kind = ActivityType.fromValue(activity.getType())
                    .map(ActivityType::target)
                    .orElse(ActivityType.Target.NONE);
            Project project = null;
            ActivityResponse.Target target = null;
            switch (kind) {
                case PROJECT -> {
                    project = targets.projects().get(activity.getTargetId());
                    if (project != null) {
                        target = ActivityResponse.Target.project(project);
                    }
                }
                case COMMENT -> {
                    Comment comment = targets.comments().get(activity.getTargetId());
                    project = comment != null ? targets.projects().get(comment.getProjectId()) : null;
                    if (project != null) {
                        target = ActivityResponse.Target.comment(comment, project);
                    }
                }
                case REPLY -> {
                    CommentReply reply = targets.replies().get(activity.getTargetId());
                    Comment comment = reply != null ? targets.comments().get(reply.getCommentId()) : null;
                    project = comment != null ? targets.projects().get(comment.getProjectId()) : null;
                    if (project != null) {
                        target = ActivityResponse.Target.reply(reply, project);
                    }
                }
                case NONE -> {
                }
            }
            if (project != null && !viewer.admin() && !project.isVisibleTo(viewer.id())) {
                continue;
            }
            responses.add(new ActivityResponse(activity.getId(), activity.getType(),
                    DateTimes.toInstant(activity.getCreatedAt()), target));
        }
        return responses;
    }

    private record Targets(Map<Long, Project> projects, Map<Long, Comment> comments, Map<Long, CommentReply> replies) {
    }
}
