package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.dto.CommentResponse;
import dev.vibeshowcase.dto.ProjectResponse;
import dev.vibeshowcase.dto.UserResponse;
import dev.vibeshowcase.entity.Comment;
import dev.vibeshowcase.entity.User;
import dev.vibeshowcase.entity.UserRole;
import dev.vibeshowcase.exception.ResourceNotFoundException;
import dev.vibeshowcase.repository.BookmarkRepository;
import dev.vibeshowcase.repository.CommentReplyRepository;
import dev.vibeshowcase.repository.CommentRepository;
import dev.vibeshowcase.repository.LikeRepository;
import dev.vibeshowcase.repository.NotificationRepository;
import dev.vibeshowcase.repository.ProjectRepository;
import dev.vibeshowcase.repository.ShareRepository;
import dev.vibeshowcase.repository.UserRepository;
import dev.vibeshowcase.security.Viewer;
import dev.vibeshowcase.util.DateTimes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Moderation. Callers are admins; access is enforced on the controller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminService {

    static final int RECENT_COMMENT_LIMIT = 20;

    private final UserRepository userRepository;
    private final ProjectRepository projectRepository;
    private final CommentRepository commentRepository;
    private final CommentReplyRepository replyRepository;
    private final LikeRepository likeRepository;
    private final BookmarkRepository bookmarkRepository;
    private final ShareRepository shareRepository;
    private final NotificationRepository notificationRepository;
    private final ProjectService projectService;
    private final CommentService commentService;
    private final ProjectEnrichmentService enrichmentService;
    private final ResilienceConfig resilience;
    private final Clock clock;

    public Mono<List<UserResponse>> getUsers() {
        return userRepository.findAllNewestFirst()
                .map(UserResponse::fromEntity)
                .collectList()
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<List<ProjectResponse>> getProjects(Viewer admin) {
        return projectRepository.findAllNewestFirst()
                .collectList()
                .flatMap(projects -> enrichmentService.enrich(projects, admin.id()))
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<List<CommentResponse>> getRecentComments() {
        return commentRepository.findRecent(RECENT_COMMENT_LIMIT)
                .collectList()
                .flatMap(comments -> {
                    Set<Long> authorIds = comments.stream().map(Comment::getAuthorId).collect(Collectors.toSet());
                    Mono<Map<Long, User>> authors = authorIds.isEmpty()
                            ? Mono.just(Map.of())
                            : userRepository.findAllById(authorIds).collectMap(User::getId);
                    return authors.map(byId -> comments.stream()
                            .map(comment -> CommentResponse.builder()
                                    .id(comment.getId())
                                    .projectId(comment.getProjectId())
                                    .content(comment.getContent())
                                    .author(ProjectEnrichmentService.authorInfo(byId.get(comment.getAuthorId())))
                                    .createdAt(DateTimes.toInstant(comment.getCreatedAt()))
                                    .updatedAt(DateTimes.toInstant(comment.getUpdatedAt()))
                                    .build())
                            .collect(Collectors.toList()));
                })
                .timeout(resilience.getDatabaseTimeout());
    }

    /**
     * Deletes the user with their projects and engagement. Shares they made stay counted
     * but lose the link to the user. Admins cannot delete themselves.
     */
    @Transactional
    public Mono<Void> deleteUser(long userId, Viewer admin) {
        if (userId == admin.id()) {
            return Mono.error(new IllegalArgumentException("error.cannot_delete_self"));
        }
        return userRepository.findById(userId)
                .switchIfEmpty(Mono.error(ResourceNotFoundException::user))
                .flatMap(user -> projectRepository.findIdsByAuthorId(userId)
                        .concatMap(projectService::deleteProjectGraph)
                        .then(likeRepository.deleteForUser(userId))
                        .then(notificationRepository.deleteByUserId(userId))
                        .then(replyRepository.deleteByUserId(userId))
                        .then(commentRepository.deleteByAuthorId(userId))
                        .then(bookmarkRepository.deleteByUserId(userId))
                        .then(shareRepository.detachUser(userId))
                        .then(userRepository.deleteById(userId)))
                .doOnSuccess(v -> log.info("User {} deleted by admin {}", userId, admin.id()))
                .timeout(resilience.getDatabaseTimeout());
    }

    @Transactional
    public Mono<Void> deleteProject(long projectId, Viewer admin) {
        return projectRepository.findById(projectId)
                .switchIfEmpty(Mono.error(ResourceNotFoundException::project))
                .flatMap(project -> projectService.deleteProjectGraph(projectId))
                .doOnSuccess(v -> log.info("Project {} deleted by admin {}", projectId, admin.id()))
                .timeout(resilience.getDatabaseTimeout());
    }

    @Transactional
    public Mono<Void> deleteComment(long commentId, Viewer admin) {
        return commentRepository.findById(commentId)
                .switchIfEmpty(Mono.error(ResourceNotFoundException::comment))
                .flatMap(comment -> commentService.deleteCommentGraph(commentId))
                .doOnSuccess(v -> log.info("Comment {} deleted by admin {}", commentId, admin.id()))
                .timeout(resilience.getDatabaseTimeout());
    }

    /**
     * Makes the project the only featured one.
     */
    @Transactional
    public Mono<Void> featureProject(long projectId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return projectRepository.findById(projectId)
                .switchIfEmpty(Mono.error(ResourceNotFoundException::project))
                .flatMap(project -> projectRepository.unfeatureAllExcept(projectId, now))
                .then(projectRepository.updateFeatured(projectId, true, now))
                .doOnNext(updated -> log.info("Project {} is now featured", projectId))
                .then()
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<Void> unfeatureProject(long projectId) {
        return projectRepository.updateFeatured(projectId, false, LocalDateTime.now(clock))
                .flatMap(updated -> updated == 0
                        ? Mono.<Void>error(ResourceNotFoundException.project())
                        : Mono.<Void>empty())
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<UserResponse> updateRole(long userId, String role) {
        return Mono.justOrEmpty(UserRole.fromValue(role))
                .switchIfEmpty(Mono.error(() -> new IllegalArgumentException("error.invalid_role")))
                .flatMap(newRole -> userRepository.updateRole(userId, newRole.value())
                        .flatMap(updated -> updated == 0
                                ? Mono.<User>error(ResourceNotFoundException.user())
                                : userRepository.findById(userId))
                        .doOnNext(user -> log.info("User {} role set to {}", userId, newRole.value())))
                .map(UserResponse::fromEntity)
                .timeout(resilience.getDatabaseTimeout());
    }
}
