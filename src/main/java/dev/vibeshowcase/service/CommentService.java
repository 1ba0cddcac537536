package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.dto.CommentPageResponse;
import dev.vibeshowcase.dto.CommentResponse;
import dev.vibeshowcase.dto.LikeResponse;
import dev.vibeshowcase.dto.PageParams;
import dev.vibeshowcase.dto.ReplyResponse;
import dev.vibeshowcase.entity.ActivityType;
import dev.vibeshowcase.entity.Comment;
import dev.vibeshowcase.entity.CommentReply;
import dev.vibeshowcase.entity.LikeTarget;
import dev.vibeshowcase.entity.NotificationType;
import dev.vibeshowcase.entity.Project;
import dev.vibeshowcase.entity.User;
import dev.vibeshowcase.exception.ResourceNotFoundException;
import dev.vibeshowcase.metrics.ShowcaseMetrics;
import dev.vibeshowcase.repository.CommentReplyRepository;
import dev.vibeshowcase.repository.CommentRepository;
import dev.vibeshowcase.repository.CommentSort;
import dev.vibeshowcase.repository.IdCount;
import dev.vibeshowcase.repository.LikeRepository;
import dev.vibeshowcase.repository.NotificationRepository;
import dev.vibeshowcase.repository.UserRepository;
import dev.vibeshowcase.security.Viewer;
import dev.vibeshowcase.util.DateTimes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Comments and replies on projects. A comment is only reachable through a project the
 * viewer can see, so every operation starts from {@link ProjectService#requireVisible}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommentService {

    private final CommentRepository commentRepository;
    private final CommentReplyRepository replyRepository;
    private final LikeRepository likeRepository;
    private final NotificationRepository notificationRepository;
    private final UserRepository userRepository;
    private final ProjectService projectService;
    private final LikeService likeService;
    private final NotificationService notificationService;
    private final ActivityService activityService;
    private final IdService idService;
    private final ShowcaseMetrics metrics;
    private final ResilienceConfig resilience;
    private final Clock clock;

    public Mono<CommentPageResponse> listComments(long projectId, PageParams page, String sort, Viewer viewer) {
        return projectService.requireVisible(projectId, viewer)
                .flatMap(project -> Mono.zip(
                                findPage(projectId, CommentSort.fromParam(sort), page).collectList(),
                                commentRepository.countByProjectId(projectId).defaultIfEmpty(0L))
                        .flatMap(tuple -> toResponses(tuple.getT1(), project, viewer)
                                .map(comments -> CommentPageResponse.of(comments, page.offset(), tuple.getT2()))))
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<CommentResponse> addComment(long projectId, String content, Viewer viewer) {
        return projectService.requireVisible(projectId, viewer)
                .flatMap(project -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    Comment comment = Comment.builder()
                            .id(idService.nextId())
                            .content(requireContent(content))
                            .projectId(projectId)
                            .authorId(viewer.id())
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return commentRepository.save(comment)
                            .flatMap(saved -> notificationService.notify(NotificationDraft.comment(project.getAuthorId(),
                                            viewer.id(), NotificationType.COMMENT_PROJECT, projectId, saved.getId()))
                                    .then(activityService.record(viewer.id(), ActivityType.COMMENT_CREATED, saved.getId()))
                                    .thenReturn(saved))
                            .flatMap(saved -> userRepository.findById(viewer.id())
                                    .map(author -> newCommentResponse(saved, author, project)));
                })
                .doOnNext(created -> {
                    metrics.commentCreated();
                    log.debug("Comment {} added to project {} by user {}", created.getId(), projectId, viewer.id());
                })
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<ReplyResponse> addReply(long commentId, String content, Viewer viewer) {
        return requireVisibleComment(commentId, viewer)
                .flatMap(context -> {
                    Comment comment = context.getT1();
                    Project project = context.getT2();
                    LocalDateTime now = LocalDateTime.now(clock);
                    CommentReply reply = CommentReply.builder()
                            .id(idService.nextId())
                            .content(requireContent(content))
                            .commentId(commentId)
                            .authorId(viewer.id())
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return replyRepository.save(reply)
                            .flatMap(saved -> notificationService.notify(NotificationDraft.reply(comment.getAuthorId(),
                                            viewer.id(), NotificationType.REPLY_COMMENT, project.getId(), commentId, saved.getId()))
                                    .then(activityService.record(viewer.id(), ActivityType.REPLY_CREATED, saved.getId()))
                                    .thenReturn(saved))
                            .flatMap(saved -> userRepository.findById(viewer.id())
                                    .map(author -> toReplyResponse(saved, author, project, 0L, false)));
                })
                .doOnNext(created -> log.debug("Reply {} added to comment {} by user {}", created.getId(), commentId, viewer.id()))
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<LikeResponse> likeComment(long commentId, Viewer viewer) {
        return requireVisibleComment(commentId, viewer)
                .flatMap(context -> likeService.like(viewer.id(), LikeTarget.comment(commentId),
                        NotificationDraft.comment(context.getT1().getAuthorId(), viewer.id(),
                                NotificationType.LIKE_COMMENT, context.getT2().getId(), commentId)));
    }

    public Mono<LikeResponse> unlikeComment(long commentId, Viewer viewer) {
        return requireVisibleComment(commentId, viewer)
                .flatMap(context -> likeService.unlike(viewer.id(), LikeTarget.comment(commentId)));
    }

    public Mono<LikeResponse> likeReply(long replyId, Viewer viewer) {
        return replyRepository.findById(replyId)
                .switchIfEmpty(Mono.error(ResourceNotFoundException::reply))
                .flatMap(reply -> requireVisibleComment(reply.getCommentId(), viewer)
                        .flatMap(context -> likeService.like(viewer.id(), LikeTarget.reply(replyId),
                                NotificationDraft.reply(reply.getAuthorId(), viewer.id(), NotificationType.LIKE_REPLY,
                                        context.getT2().getId(), reply.getCommentId(), replyId))));
    }

    public Mono<LikeResponse> unlikeReply(long replyId, Viewer viewer) {
        return replyRepository.findById(replyId)
                .switchIfEmpty(Mono.error(ResourceNotFoundException::reply))
                .flatMap(reply -> requireVisibleComment(reply.getCommentId(), viewer))
                .flatMap(context -> likeService.unlike(viewer.id(), LikeTarget.reply(replyId)));
    }

    /**
     * Deletes the comment with its replies, likes and notifications. Runs in the caller's transaction.
     */
    public Mono<Void> deleteCommentGraph(long commentId) {
        return likeRepository.deleteForComment(commentId)
                .then(notificationRepository.deleteByCommentId(commentId))
                .then(replyRepository.deleteByCommentId(commentId))
                .then(commentRepository.deleteById(commentId));
    }

    private Mono<Tuple2<Comment, Project>> requireVisibleComment(long commentId, Viewer viewer) {
        return commentRepository.findById(commentId)
                .switchIfEmpty(Mono.error(ResourceNotFoundException::comment))
                .flatMap(comment -> projectService.requireVisible(comment.getProjectId(), viewer)
                        .map(project -> Tuples.of(comment, project)));
    }

    private Flux<Comment> findPage(long projectId, CommentSort sort, PageParams page) {
        switch (sort) {
            case OLDEST:
                return commentRepository.findOldest(projectId, page.limit(), page.offset());
            case MOST_LIKED:
                return commentRepository.findMostLiked(projectId, page.limit(), page.offset());
            default:
                return commentRepository.findNewest(projectId, page.limit(), page.offset());
        }
    }

    // ==================== RESPONSE ASSEMBLY ====================

    private Mono<List<CommentResponse>> toResponses(List<Comment> comments, Project project, Viewer viewer) {
        if (comments.isEmpty()) {
            return Mono.just(List.of());
        }
        Long[] commentIds = comments.stream().map(Comment::getId).toArray(Long[]::new);

        return replyRepository.findByCommentIds(commentIds).collectList().flatMap(replies -> {
            Long[] replyIds = replies.stream().map(CommentReply::getId).toArray(Long[]::new);
            Set<Long> authorIds = new HashSet<>();
            comments.forEach(c -> authorIds.add(c.getAuthorId()));
            replies.forEach(r -> authorIds.add(r.getAuthorId()));

            return Mono.zip(
                    likeCounts(LikeTarget.Type.COMMENT, commentIds),
                    likedIds(viewer, LikeTarget.Type.COMMENT, commentIds),
                    likeCounts(LikeTarget.Type.REPLY, replyIds),
                    likedIds(viewer, LikeTarget.Type.REPLY, replyIds),
                    userRepository.findAllById(authorIds).collectMap(User::getId)
            ).map(tuple -> {
                Map<Long, Long> commentLikes = tuple.getT1();
                Set<Long> likedComments = tuple.getT2();
                Map<Long, Long> replyLikes = tuple.getT3();
                Set<Long> likedReplies = tuple.getT4();
                Map<Long, User> authors = tuple.getT5();

                Map<Long, List<ReplyResponse>> repliesByComment = new LinkedHashMap<>();
                for (CommentReply reply : replies) {
                    repliesByComment.computeIfAbsent(reply.getCommentId(), k -> new ArrayList<>())
                            .add(toReplyResponse(reply, authors.get(reply.getAuthorId()), project,
                                    replyLikes.getOrDefault(reply.getId(), 0L), likedReplies.contains(reply.getId())));
                }

                return comments.stream().map(comment -> {
                    CommentResponse response = newCommentResponse(comment, authors.get(comment.getAuthorId()), project);
                    response.setLikesCount(commentLikes.getOrDefault(comment.getId(), 0L));
                    response.setIsLiked(likedComments.contains(comment.getId()));
                    response.setReplies(repliesByComment.getOrDefault(comment.getId(), List.of()));
                    return response;
                }).collect(Collectors.toList());
            });
        });
    }

    private Mono<Map<Long, Long>> likeCounts(LikeTarget.Type type, Long[] ids) {
        if (ids.length == 0) {
            return Mono.just(Map.of());
        }
        return likeRepository.countByTargets(type, ids).collectMap(IdCount::id, IdCount::count);
    }

    private Mono<Set<Long>> likedIds(Viewer viewer, LikeTarget.Type type, Long[] ids) {
        if (viewer.isAnonymous() || ids.length == 0) {
            return Mono.just(Set.of());
        }
        return likeRepository.findLikedTargetIds(viewer.id(), type, ids).collect(Collectors.toSet());
    }

    private CommentResponse newCommentResponse(Comment comment, User author, Project project) {
        return CommentResponse.builder()
                .id(comment.getId())
                .projectId(comment.getProjectId())
                .content(comment.getContent())
                .author(ProjectEnrichmentService.authorInfo(author))
                .likesCount(0L)
                .isLiked(false)
                .isAuthor(comment.getAuthorId().equals(project.getAuthorId()))
                .replies(List.of())
                .createdAt(DateTimes.toInstant(comment.getCreatedAt()))
                .updatedAt(DateTimes.toInstant(comment.getUpdatedAt()))
                .build();
    }

    private ReplyResponse toReplyResponse(CommentReply reply, User author, Project project, long likes, boolean liked) {
        return ReplyResponse.builder()
                .id(reply.getId())
                .commentId(reply.getCommentId())
                .content(reply.getContent())
                .author(ProjectEnrichmentService.authorInfo(author))
                .likesCount(likes)
                .isLiked(liked)
                .isAuthor(reply.getAuthorId().equals(project.getAuthorId()))
                .createdAt(DateTimes.toInstant(reply.getCreatedAt()))
                .updatedAt(DateTimes.toInstant(reply.getUpdatedAt()))
                .build();
    }

    private static String requireContent(String content) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("error.content_required");
        }
        return content.trim();
    }
}
