package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.dto.BookmarkResponse;
import dev.vibeshowcase.dto.GalleryImageRequest;
import dev.vibeshowcase.dto.GalleryImageResponse;
import dev.vibeshowcase.dto.LikeResponse;
import dev.vibeshowcase.dto.PageParams;
import dev.vibeshowcase.dto.ProjectEnvelope;
import dev.vibeshowcase.dto.ProjectListResponse;
import dev.vibeshowcase.dto.ProjectPageResponse;
import dev.vibeshowcase.dto.ProjectRequest;
import dev.vibeshowcase.dto.ProjectResponse;
import dev.vibeshowcase.dto.ProjectUpdateRequest;
import dev.vibeshowcase.dto.ShareResponse;
import dev.vibeshowcase.entity.ActivityType;
import dev.vibeshowcase.entity.GalleryImage;
import dev.vibeshowcase.entity.LikeTarget;
import dev.vibeshowcase.entity.NotificationType;
import dev.vibeshowcase.entity.Project;
import dev.vibeshowcase.entity.Share;
import dev.vibeshowcase.exception.ResourceNotFoundException;
import dev.vibeshowcase.metrics.ShowcaseMetrics;
import dev.vibeshowcase.repository.BookmarkRepository;
import dev.vibeshowcase.repository.CommentReplyRepository;
import dev.vibeshowcase.repository.CommentRepository;
import dev.vibeshowcase.repository.GalleryImageRepository;
import dev.vibeshowcase.repository.LikeRepository;
import dev.vibeshowcase.repository.NotificationRepository;
import dev.vibeshowcase.repository.ProjectFilter;
import dev.vibeshowcase.repository.ProjectQueryRepository;
import dev.vibeshowcase.repository.ProjectRepository;
import dev.vibeshowcase.repository.ProjectSort;
import dev.vibeshowcase.repository.ProjectTagRepository;
import dev.vibeshowcase.repository.ProjectViewRepository;
import dev.vibeshowcase.repository.ShareRepository;
import dev.vibeshowcase.repository.TrendingCandidate;
import dev.vibeshowcase.security.Viewer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Project listing, detail and lifecycle.
 *
 * <p>Listing flow: the filter resolver turns the query into a {@link ProjectFilter}, the page
 * of ids is selected in SQL (or, for trending, the whole candidate set is ranked in memory
 * and then sliced), rows are loaded and enriched, and the page is composed with the total
 * counted under the same filter.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectService {

    private final ProjectRepository projectRepository;
    private final ProjectQueryRepository projectQueryRepository;
    private final ProjectTagRepository projectTagRepository;
    private final ProjectViewRepository projectViewRepository;
    private final GalleryImageRepository galleryImageRepository;
    private final BookmarkRepository bookmarkRepository;
    private final CommentRepository commentRepository;
    private final CommentReplyRepository commentReplyRepository;
    private final LikeRepository likeRepository;
    private final ShareRepository shareRepository;
    private final NotificationRepository notificationRepository;
    private final ProjectFilterResolver filterResolver;
    private final TrendingScorer trendingScorer;
    private final ProjectEnrichmentService enrichmentService;
    private final ProjectViewService projectViewService;
    private final LikeService likeService;
    private final ActivityService activityService;
    private final TagService tagService;
    private final IdService idService;
    private final ShowcaseMetrics metrics;
    private final ResilienceConfig resilience;
    private final Clock clock;

    // ==================== LISTING ====================

    public Mono<ProjectPageResponse> listProjects(ProjectQuery query, PageParams page, Viewer viewer) {
        return filterResolver.resolve(query, viewer.id())
                .flatMap(filter -> query.sort() == ProjectSort.TRENDING
                        ? trendingPage(filter, page, viewer)
                        : sortedPage(filter, query.sort(), page, viewer))
                .defaultIfEmpty(ProjectPageResponse.empty())
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<ProjectListResponse> getTrending(int limit, Viewer viewer) {
        return listProjects(new ProjectQuery(null, null, null, ProjectSort.TRENDING), new PageParams(1, limit), viewer)
                .map(page -> new ProjectListResponse(page.projects()));
    }

    public Mono<ProjectEnvelope> getFeatured(Viewer viewer) {
        return projectRepository.findLatestFeatured(viewer.id())
                .flatMap(project -> enrichmentService.enrichOne(project, viewer.id()))
                .map(ProjectEnvelope::new)
                .defaultIfEmpty(new ProjectEnvelope(null))
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<ProjectListResponse> getBookmarks(Viewer viewer) {
        return projectRepository.findBookmarkedBy(viewer.id())
                .collectList()
                .flatMap(projects -> enrichmentService.enrich(projects, viewer.id()))
                .map(ProjectListResponse::new)
                .timeout(resilience.getDatabaseTimeout());
    }

    private Mono<ProjectPageResponse> sortedPage(ProjectFilter filter, ProjectSort sort, PageParams page, Viewer viewer) {
        return Mono.zip(
                projectQueryRepository.findPageIds(filter, sort, page.limit(), page.offset()).collectList(),
                projectQueryRepository.count(filter)
        ).flatMap(tuple -> loadInOrder(tuple.getT1())
                .flatMap(projects -> enrichmentService.enrich(projects, viewer.id()))
                .map(projects -> ProjectPageResponse.of(projects, page.offset(), tuple.getT2())));
    }

    // ranks every candidate, then slices the requested page
    private Mono<ProjectPageResponse> trendingPage(ProjectFilter filter, PageParams page, Viewer viewer) {
        YearMonth month = trendingScorer.currentMonth();
        return projectQueryRepository.findTrendingCandidates(filter, month.getMonthValue(), month.getYear())
                .collectList()
                .flatMap(candidates -> {
                    List<TrendingCandidate> ranked = trendingScorer.rank(candidates);
                    int from = (int) Math.min(page.offset(), ranked.size());
                    int to = Math.min(from + page.limit(), ranked.size());
                    List<Long> ids = ranked.subList(from, to).stream().map(TrendingCandidate::projectId).toList();
                    return loadInOrder(ids)
                            .flatMap(projects -> enrichmentService.enrich(projects, viewer.id()))
                            .map(projects -> ProjectPageResponse.of(projects, page.offset(), ranked.size()));
                });
    }

    private Mono<List<Project>> loadInOrder(List<Long> ids) {
        if (ids.isEmpty()) {
            return Mono.just(List.of());
        }
        return projectRepository.findAllById(ids)
                .collectMap(Project::getId)
                .map(byId -> ids.stream().map(byId::get).filter(Objects::nonNull).toList());
    }

    // ==================== DETAIL ====================

    /**
     * Loads a project for display and counts the view. A failure to count is logged and
     * does not fail the request.
     */
    public Mono<ProjectEnvelope> getProject(long projectId, Viewer viewer) {
        return requireVisible(projectId, viewer)
                .flatMap(project -> projectViewService.recordView(projectId)
                        .onErrorResume(e -> {
                            log.warn("Failed to record view for project {}: {}", projectId, e.getMessage());
                            return Mono.just(false);
                        })
                        .map(counted -> {
                            if (counted) {
                                project.setViewsCount(project.getViewsCount() + 1);
                            }
                            return project;
                        }))
                .flatMap(project -> toDetail(project, viewer))
                .map(ProjectEnvelope::new);
    }

    public Mono<Boolean> recordView(long projectId, Viewer viewer) {
        return requireVisible(projectId, viewer)
                .flatMap(project -> projectViewService.recordView(projectId));
    }

    /**
     * The project if it exists and the viewer may see it; 404 otherwise. Admins see
     * every project.
     */
    public Mono<Project> requireVisible(long projectId, Viewer viewer) {
        return projectRepository.findById(projectId)
                .filter(project -> viewer.admin() || project.isVisibleTo(viewer.id()))
                .switchIfEmpty(Mono.error(ResourceNotFoundException::project))
                .timeout(resilience.getDatabaseTimeout());
    }

    private Mono<ProjectResponse> toDetail(Project project, Viewer viewer) {
        return Mono.zip(
                enrichmentService.enrichOne(project, viewer.id()),
                galleryImageRepository.findByProjectId(project.getId())
                        .map(GalleryImageResponse::fromEntity)
                        .collectList()
        ).map(tuple -> {
            ProjectResponse response = tuple.getT1();
            response.setGalleryImages(tuple.getT2());
            return response;
        });
    }

    // ==================== LIFECYCLE ====================

    @Transactional
    public Mono<ProjectResponse> createProject(ProjectRequest request, Viewer viewer) {
        LocalDateTime now = LocalDateTime.now(clock);
        Project project = Project.builder()
                .id(idService.nextId())
                .title(request.getTitle().trim())
                .description(request.getDescription().trim())
                .longDescription(request.getLongDescription())
                .projectUrl(request.getProjectUrl().trim())
                .imageUrl(StringUtils.hasText(request.getImageUrl()) ? request.getImageUrl().trim() : Project.DEFAULT_IMAGE_URL)
                .vibeCodingTool(trimToNull(request.getVibeCodingTool()))
                .authorId(viewer.id())
                .featured(false)
                .isPrivate(Boolean.TRUE.equals(request.getIsPrivate()))
                .createdAt(now)
                .updatedAt(now)
                .build();

        return projectRepository.save(project)
                .flatMap(saved -> tagService.attachTags(saved.getId(), request.getTags())
                        .then(saveGallery(saved.getId(), request.getGalleryImages(), now))
                        .then(activityService.record(viewer.id(), ActivityType.PROJECT_CREATED, saved.getId()))
                        .thenReturn(saved))
                .flatMap(saved -> toDetail(saved, viewer))
                .doOnNext(created -> {
                    metrics.projectCreated();
                    log.info("Project {} created by user {}", created.getId(), viewer.id());
                })
                .timeout(resilience.getDatabaseTimeout());
    }

    @Transactional
    public Mono<ProjectResponse> updateProject(long projectId, ProjectUpdateRequest request, Viewer viewer) {
        return requireModifiable(projectId, viewer)
                .flatMap(project -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    applyUpdate(project, request);
                    project.setUpdatedAt(now);

                    Mono<Void> tags = request.getTags() != null
                            ? tagService.replaceTags(projectId, request.getTags())
                            : Mono.empty();
                    Mono<Void> gallery = request.getGalleryImages() != null
                            ? galleryImageRepository.deleteByProjectId(projectId)
                                    .then(saveGallery(projectId, request.getGalleryImages(), now))
                            : Mono.empty();

                    return projectRepository.save(project)
                            .flatMap(saved -> tags.then(gallery)
                                    .then(activityService.record(viewer.id(), ActivityType.PROJECT_UPDATED, projectId))
                                    .thenReturn(saved));
                })
                .flatMap(saved -> toDetail(saved, viewer))
                .doOnSuccess(updated -> log.info("Project {} updated by user {}", projectId, viewer.id()))
                .timeout(resilience.getDatabaseTimeout());
    }

    @Transactional
    public Mono<Void> deleteProject(long projectId, Viewer viewer) {
        return requireModifiable(projectId, viewer)
                .flatMap(project -> deleteProjectGraph(projectId)
                        .then(activityService.record(viewer.id(), ActivityType.PROJECT_DELETED, projectId)))
                .doOnSuccess(v -> log.info("Project {} deleted by user {}", projectId, viewer.id()))
                .timeout(resilience.getDatabaseTimeout());
    }

    /**
     * Deletes the project and everything that references it, children first.
     * Runs in the caller's transaction.
     */
    public Mono<Void> deleteProjectGraph(long projectId) {
        return projectViewRepository.deleteByProjectId(projectId)
                .then(shareRepository.deleteByProjectId(projectId))
                .then(likeRepository.deleteForProject(projectId))
                .then(bookmarkRepository.deleteByProjectId(projectId))
                .then(galleryImageRepository.deleteByProjectId(projectId))
                .then(notificationRepository.deleteByProjectId(projectId))
                .then(commentReplyRepository.deleteByProjectId(projectId))
                .then(commentRepository.deleteByProjectId(projectId))
                .then(projectTagRepository.deleteByProjectId(projectId))
                .then(projectRepository.deleteById(projectId));
    }

    private Mono<Project> requireModifiable(long projectId, Viewer viewer) {
        return projectRepository.findById(projectId)
                .switchIfEmpty(Mono.error(ResourceNotFoundException::project))
                .flatMap(project -> viewer.canModify(project.getAuthorId())
                        ? Mono.just(project)
                        : Mono.error(new AccessDeniedException("error.only_author_or_admin")));
    }

    private void applyUpdate(Project project, ProjectUpdateRequest request) {
        if (request.getTitle() != null) {
            project.setTitle(request.getTitle().trim());
        }
        if (request.getDescription() != null) {
            project.setDescription(request.getDescription().trim());
        }
        if (request.getLongDescription() != null) {
            project.setLongDescription(request.getLongDescription());
        }
        if (request.getProjectUrl() != null) {
            project.setProjectUrl(request.getProjectUrl().trim());
        }
        if (request.getImageUrl() != null) {
            project.setImageUrl(StringUtils.hasText(request.getImageUrl())
                    ? request.getImageUrl().trim() : Project.DEFAULT_IMAGE_URL);
        }
        if (request.getVibeCodingTool() != null) {
            project.setVibeCodingTool(trimToNull(request.getVibeCodingTool()));
        }
        if (request.getIsPrivate() != null) {
            project.setIsPrivate(request.getIsPrivate());
        }
    }

    private Mono<Void> saveGallery(long projectId, List<GalleryImageRequest> images, LocalDateTime now) {
        if (images == null || images.isEmpty()) {
            return Mono.empty();
        }
        List<GalleryImage> rows = new ArrayList<>(images.size());
        for (int i = 0; i < images.size(); i++) {
            GalleryImageRequest image = images.get(i);
            rows.add(GalleryImage.builder()
                    .id(idService.nextId())
                    .projectId(projectId)
                    .imageUrl(image.imageUrl().trim())
                    .caption(trimToNull(image.caption()))
                    .displayOrder(i)
                    .createdAt(now)
                    .build());
        }
        return galleryImageRepository.saveAll(rows).then();
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    // ==================== ENGAGEMENT ====================

    public Mono<LikeResponse> like(long projectId, Viewer viewer) {
        return requireVisible(projectId, viewer)
                .flatMap(project -> likeService.like(viewer.id(), LikeTarget.project(projectId),
                        NotificationDraft.project(project.getAuthorId(), viewer.id(), NotificationType.LIKE_PROJECT, projectId)));
    }

    public Mono<LikeResponse> unlike(long projectId, Viewer viewer) {
        return requireVisible(projectId, viewer)
                .flatMap(project -> likeService.unlike(viewer.id(), LikeTarget.project(projectId)));
    }

    public Mono<BookmarkResponse> bookmark(long projectId, Viewer viewer) {
        return requireVisible(projectId, viewer)
                .flatMap(project -> bookmarkRepository.insertIfAbsent(idService.nextId(), viewer.id(), projectId,
                        LocalDateTime.now(clock)))
                .doOnNext(inserted -> log.debug("Bookmark project={} user={} inserted={}", projectId, viewer.id(), inserted))
                .flatMap(inserted -> inserted > 0
                        ? activityService.record(viewer.id(), ActivityType.PROJECT_BOOKMARKED, projectId)
                        : Mono.<Void>empty())
                .thenReturn(new BookmarkResponse(true, true));
    }

    public Mono<BookmarkResponse> unbookmark(long projectId, Viewer viewer) {
        return requireVisible(projectId, viewer)
                .flatMap(project -> bookmarkRepository.deleteByUserIdAndProjectId(viewer.id(), projectId))
                .thenReturn(new BookmarkResponse(true, false));
    }

    /**
     * Records a share. Anonymous shares are counted without a user.
     */
    @Transactional
    public Mono<ShareResponse> share(long projectId, String platform, Viewer viewer) {
        return requireVisible(projectId, viewer)
                .flatMap(project -> shareRepository.save(Share.builder()
                        .id(idService.nextId())
                        .projectId(projectId)
                        .userId(viewer.isAnonymous() ? null : viewer.id())
                        .platform(platform.trim())
                        .createdAt(LocalDateTime.now(clock))
                        .build()))
                .then(projectRepository.incrementShares(projectId))
                .then(activityService.record(viewer.id(), ActivityType.PROJECT_SHARED, projectId))
                .then(projectRepository.findSharesCount(projectId))
                .map(count -> {
                    metrics.shared();
                    return new ShareResponse(true, count);
                })
                .timeout(resilience.getDatabaseTimeout());
    }
}
