package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.dto.PageParams;
import dev.vibeshowcase.dto.ProjectResponse;
import dev.vibeshowcase.dto.ProjectUpdateRequest;
import dev.vibeshowcase.entity.ActivityType;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.access.AccessDeniedException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProjectServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-15T12:00:00Z");

    @Mock private ProjectRepository projectRepository;
    @Mock private ProjectQueryRepository projectQueryRepository;
    @Mock private ProjectTagRepository projectTagRepository;
    @Mock private ProjectViewRepository projectViewRepository;
    @Mock private GalleryImageRepository galleryImageRepository;
    @Mock private BookmarkRepository bookmarkRepository;
    @Mock private CommentRepository commentRepository;
    @Mock private CommentReplyRepository commentReplyRepository;
    @Mock private LikeRepository likeRepository;
    @Mock private ShareRepository shareRepository;
    @Mock private NotificationRepository notificationRepository;
    @Mock private ProjectFilterResolver filterResolver;
    @Mock private ProjectEnrichmentService enrichmentService;
    @Mock private ProjectViewService projectViewService;
    @Mock private LikeService likeService;
    @Mock private ActivityService activityService;
    @Mock private TagService tagService;
    @Mock private IdService idService;
    @Mock private ShowcaseMetrics metrics;

    private ProjectService projectService;

    private final Viewer ada = Viewer.user(5L, "ada");
    private final ProjectFilter filter = ProjectFilter.visibleTo(0L).build();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        projectService = new ProjectService(projectRepository, projectQueryRepository, projectTagRepository,
                projectViewRepository, galleryImageRepository, bookmarkRepository, commentRepository,
                commentReplyRepository, likeRepository, shareRepository, notificationRepository, filterResolver,
                new TrendingScorer(clock), enrichmentService, projectViewService, likeService, activityService, tagService,
                idService, metrics, new ResilienceConfig(10, 30), clock);

        lenient().when(activityService.record(anyLong(), any(ActivityType.class), anyLong())).thenReturn(Mono.empty());
        lenient().when(enrichmentService.enrich(anyList(), anyLong())).thenAnswer(invocation -> {
            List<Project> projects = invocation.getArgument(0);
            return Mono.just(projects.stream()
                    .map(p -> ProjectResponse.builder().id(p.getId()).title(p.getTitle()).viewsCount(p.getViewsCount()).build())
                    .toList());
        });
        lenient().when(enrichmentService.enrichOne(any(Project.class), anyLong())).thenAnswer(invocation -> {
            Project p = invocation.getArgument(0);
            return Mono.just(ProjectResponse.builder().id(p.getId()).title(p.getTitle()).viewsCount(p.getViewsCount()).build());
        });
    }

    private static LocalDateTime daysAgo(int days) {
        return LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).minusDays(days);
    }

    private static Project project(long id, Long authorId, boolean isPrivate) {
        return Project.builder().id(id).title("Project " + id).authorId(authorId).isPrivate(isPrivate)
                .viewsCount(3).createdAt(daysAgo(1)).newRecord(false).build();
    }

    @Nested
    @DisplayName("listProjects")
    class ListProjects {

        @Test
        @DisplayName("Should return an empty page when a named filter target does not exist")
        void shouldReturnEmptyPageForUnresolvedFilter() {
            when(filterResolver.resolve(any(), eq(0L))).thenReturn(Mono.empty());

            StepVerifier.create(projectService.listProjects(ProjectQuery.of("nope", null, null, null),
                            new PageParams(1, 6), Viewer.ANONYMOUS))
                    .assertNext(page -> {
                        assertThat(page.projects()).isEmpty();
                        assertThat(page.hasMore()).isFalse();
                        assertThat(page.total()).isZero();
                    })
                    .verifyComplete();

            verifyNoInteractions(projectQueryRepository);
        }

        @Test
        @DisplayName("Should keep the SQL order for sorted listings and report hasMore")
        void shouldComposeSortedPage() {
            when(filterResolver.resolve(any(), eq(0L))).thenReturn(Mono.just(filter));
            when(projectQueryRepository.findPageIds(filter, ProjectSort.LATEST, 2, 0L)).thenReturn(Flux.just(2L, 1L));
            when(projectQueryRepository.count(filter)).thenReturn(Mono.just(5L));
            when(projectRepository.findAllById(anyIterable()))
                    .thenReturn(Flux.just(project(1L, 5L, false), project(2L, 5L, false)));

            StepVerifier.create(projectService.listProjects(ProjectQuery.of(null, null, null, "latest"),
                            new PageParams(1, 2), Viewer.ANONYMOUS))
                    .assertNext(page -> {
                        assertThat(page.projects()).extracting(ProjectResponse::getId).containsExactly(2L, 1L);
                        assertThat(page.hasMore()).isTrue();
                        assertThat(page.total()).isEqualTo(5L);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should rank all trending candidates before slicing the page")
        void shouldRankBeforePaginating() {
            when(filterResolver.resolve(any(), eq(0L))).thenReturn(Mono.just(filter));
            when(projectQueryRepository.findTrendingCandidates(filter, 3, 2025)).thenReturn(Flux.just(
                    new TrendingCandidate(1L, daysAgo(40), 10),
                    new TrendingCandidate(2L, daysAgo(1), 0),
                    new TrendingCandidate(3L, daysAgo(10), 0)));
            when(projectRepository.findAllById(List.of(3L))).thenReturn(Flux.just(project(3L, 5L, false)));

            StepVerifier.create(projectService.listProjects(ProjectQuery.of(null, null, null, null),
                            new PageParams(2, 1), Viewer.ANONYMOUS))
                    .assertNext(page -> {
                        assertThat(page.projects()).extracting(ProjectResponse::getId).containsExactly(3L);
                        assertThat(page.hasMore()).isTrue();
                        assertThat(page.total()).isEqualTo(3L);
                    })
                    .verifyComplete();

            verify(projectQueryRepository, never()).findPageIds(any(), any(), anyInt(), anyLong());
        }

        @Test
        @DisplayName("Should return an empty trending page past the last candidate")
        void shouldHandlePagePastEnd() {
            when(filterResolver.resolve(any(), eq(0L))).thenReturn(Mono.just(filter));
            when(projectQueryRepository.findTrendingCandidates(filter, 3, 2025))
                    .thenReturn(Flux.just(new TrendingCandidate(1L, daysAgo(2), 0)));

            StepVerifier.create(projectService.listProjects(ProjectQuery.of(null, null, null, "trending"),
                            new PageParams(3, 6), Viewer.ANONYMOUS))
                    .assertNext(page -> {
                        assertThat(page.projects()).isEmpty();
                        assertThat(page.hasMore()).isFalse();
                        assertThat(page.total()).isEqualTo(1L);
                    })
                    .verifyComplete();

            verify(projectRepository, never()).findAllById(anyIterable());
        }
    }

    @Nested
    @DisplayName("getProject")
    class GetProject {

        @Test
        @DisplayName("Should hide another user's private project")
        void shouldHidePrivateProject() {
            when(projectRepository.findById(7L)).thenReturn(Mono.just(project(7L, 99L, true)));

            StepVerifier.create(projectService.getProject(7L, ada))
                    .expectError(ResourceNotFoundException.class)
                    .verify();

            verifyNoInteractions(projectViewService);
        }

        @Test
        @DisplayName("Should show a private project to its author and count the view")
        void shouldShowPrivateProjectToAuthor() {
            when(projectRepository.findById(7L)).thenReturn(Mono.just(project(7L, 5L, true)));
            when(projectViewService.recordView(7L)).thenReturn(Mono.just(true));
            when(galleryImageRepository.findByProjectId(7L)).thenReturn(Flux.empty());

            StepVerifier.create(projectService.getProject(7L, ada))
                    .assertNext(envelope -> {
                        assertThat(envelope.project().getId()).isEqualTo(7L);
                        assertThat(envelope.project().getViewsCount()).isEqualTo(4);
                        assertThat(envelope.project().getGalleryImages()).isEmpty();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should still return the project when counting the view fails")
        void shouldTolerateViewFailure() {
            when(projectRepository.findById(7L)).thenReturn(Mono.just(project(7L, 99L, false)));
            when(projectViewService.recordView(7L)).thenReturn(Mono.error(new IllegalStateException("db down")));
            when(galleryImageRepository.findByProjectId(7L)).thenReturn(Flux.empty());

            StepVerifier.create(projectService.getProject(7L, Viewer.ANONYMOUS))
                    .assertNext(envelope -> assertThat(envelope.project().getViewsCount()).isEqualTo(3))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should return 404 for a missing project")
        void shouldFailForMissingProject() {
            when(projectRepository.findById(8L)).thenReturn(Mono.empty());

            StepVerifier.create(projectService.getProject(8L, Viewer.ANONYMOUS))
                    .expectErrorMessage("error.project_not_found")
                    .verify();
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should forbid updates by someone other than the author")
        void shouldForbidForeignUpdate() {
            when(projectRepository.findById(7L)).thenReturn(Mono.just(project(7L, 99L, false)));

            StepVerifier.create(projectService.updateProject(7L, new ProjectUpdateRequest(), ada))
                    .expectError(AccessDeniedException.class)
                    .verify();

            verify(projectRepository, never()).save(any(Project.class));
        }

        @Test
        @DisplayName("Should let an admin delete any project")
        void shouldLetAdminDelete() {
            when(projectRepository.findById(7L)).thenReturn(Mono.just(project(7L, 99L, false)));
            when(projectViewRepository.deleteByProjectId(7L)).thenReturn(Mono.empty());
            when(shareRepository.deleteByProjectId(7L)).thenReturn(Mono.just(0));
            when(likeRepository.deleteForProject(7L)).thenReturn(Mono.empty());
            when(bookmarkRepository.deleteByProjectId(7L)).thenReturn(Mono.just(0));
            when(galleryImageRepository.deleteByProjectId(7L)).thenReturn(Mono.just(0));
            when(notificationRepository.deleteByProjectId(7L)).thenReturn(Mono.just(0));
            when(commentReplyRepository.deleteByProjectId(7L)).thenReturn(Mono.just(0));
            when(commentRepository.deleteByProjectId(7L)).thenReturn(Mono.just(0));
            when(projectTagRepository.deleteByProjectId(7L)).thenReturn(Mono.empty());
            when(projectRepository.deleteById(7L)).thenReturn(Mono.empty());

            StepVerifier.create(projectService.deleteProject(7L, Viewer.admin(1L, "root")))
                    .verifyComplete();

            verify(projectRepository).deleteById(7L);
            verify(activityService).record(1L, ActivityType.PROJECT_DELETED, 7L);
        }
    }

    @Nested
    @DisplayName("engagement")
    class Engagement {

        @Test
        @DisplayName("Should record anonymous shares without a user")
        void shouldShareAnonymously() {
            when(projectRepository.findById(7L)).thenReturn(Mono.just(project(7L, 5L, false)));
            when(idService.nextId()).thenReturn(500L);
            when(shareRepository.save(any(Share.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
            when(projectRepository.incrementShares(7L)).thenReturn(Mono.just(1));
            when(projectRepository.findSharesCount(7L)).thenReturn(Mono.just(4));

            StepVerifier.create(projectService.share(7L, " twitter ", Viewer.ANONYMOUS))
                    .assertNext(response -> {
                        assertThat(response.success()).isTrue();
                        assertThat(response.sharesCount()).isEqualTo(4);
                    })
                    .verifyComplete();

            ArgumentCaptor<Share> captor = ArgumentCaptor.forClass(Share.class);
            verify(shareRepository).save(captor.capture());
            assertThat(captor.getValue().getUserId()).isNull();
            assertThat(captor.getValue().getPlatform()).isEqualTo("twitter");
            verify(metrics).shared();
            verify(activityService).record(Viewer.ANONYMOUS_ID, ActivityType.PROJECT_SHARED, 7L);
        }

        @Test
        @DisplayName("Should report a bookmark even when it already existed")
        void shouldBookmarkIdempotently() {
            when(projectRepository.findById(7L)).thenReturn(Mono.just(project(7L, 99L, false)));
            when(idService.nextId()).thenReturn(600L);
            when(bookmarkRepository.insertIfAbsent(eq(600L), eq(5L), eq(7L), any(LocalDateTime.class)))
                    .thenReturn(Mono.just(0));

            StepVerifier.create(projectService.bookmark(7L, ada))
                    .assertNext(response -> assertThat(response.isBookmarked()).isTrue())
                    .verifyComplete();

            verify(activityService, never()).record(anyLong(), any(ActivityType.class), anyLong());
        }

        @Test
        @DisplayName("Should record activity only for a new bookmark")
        void shouldRecordNewBookmark() {
            when(projectRepository.findById(7L)).thenReturn(Mono.just(project(7L, 99L, false)));
            when(idService.nextId()).thenReturn(601L);
            when(bookmarkRepository.insertIfAbsent(eq(601L), eq(5L), eq(7L), any(LocalDateTime.class)))
                    .thenReturn(Mono.just(1));

            StepVerifier.create(projectService.bookmark(7L, ada))
                    .assertNext(response -> assertThat(response.isBookmarked()).isTrue())
                    .verifyComplete();

            verify(activityService).record(5L, ActivityType.PROJECT_BOOKMARKED, 7L);
        }

        @Test
        @DisplayName("Should return null from getFeatured when nothing is featured")
        void shouldReturnNullFeatured() {
            when(projectRepository.findLatestFeatured(0L)).thenReturn(Mono.empty());

            StepVerifier.create(projectService.getFeatured(Viewer.ANONYMOUS))
                    .assertNext(envelope -> assertThat(envelope.project()).isNull())
                    .verifyComplete();
        }
    }
}
