package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.entity.Project;
import dev.vibeshowcase.entity.User;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdminServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T08:00:00Z");

    @Mock private UserRepository userRepository;
    @Mock private ProjectRepository projectRepository;
    @Mock private CommentRepository commentRepository;
    @Mock private CommentReplyRepository replyRepository;
    @Mock private LikeRepository likeRepository;
    @Mock private BookmarkRepository bookmarkRepository;
    @Mock private ShareRepository shareRepository;
    @Mock private NotificationRepository notificationRepository;
    @Mock private ProjectService projectService;
    @Mock private CommentService commentService;
    @Mock private ProjectEnrichmentService enrichmentService;

    private AdminService adminService;

    private final Viewer admin = Viewer.admin(1L, "root");

    @BeforeEach
    void setUp() {
        adminService = new AdminService(userRepository, projectRepository, commentRepository, replyRepository,
                likeRepository, bookmarkRepository, shareRepository, notificationRepository, projectService,
                commentService, enrichmentService, new ResilienceConfig(10, 30), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("deleteUser")
    class DeleteUser {

        @Test
        @DisplayName("Should refuse to delete the calling admin")
        void shouldRejectSelfDelete() {
            StepVerifier.create(adminService.deleteUser(1L, admin))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(IllegalArgumentException.class)
                            .hasMessage("error.cannot_delete_self"))
                    .verify();

            verifyNoInteractions(userRepository, projectService);
        }

        @Test
        @DisplayName("Should fail with 404 for an unknown user")
        void shouldFailForUnknownUser() {
            when(userRepository.findById(8L)).thenReturn(Mono.empty());

            StepVerifier.create(adminService.deleteUser(8L, admin))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should delete the user's projects one by one and keep their shares")
        void shouldCascade() {
            when(userRepository.findById(8L)).thenReturn(Mono.just(User.builder().id(8L).username("bob").build()));
            when(projectRepository.findIdsByAuthorId(8L)).thenReturn(Flux.just(70L, 71L));
            when(projectService.deleteProjectGraph(anyLong())).thenReturn(Mono.empty());
            when(likeRepository.deleteForUser(8L)).thenReturn(Mono.empty());
            when(notificationRepository.deleteByUserId(8L)).thenReturn(Mono.just(2));
            when(replyRepository.deleteByUserId(8L)).thenReturn(Mono.just(0));
            when(commentRepository.deleteByAuthorId(8L)).thenReturn(Mono.just(1));
            when(bookmarkRepository.deleteByUserId(8L)).thenReturn(Mono.just(0));
            when(shareRepository.detachUser(8L)).thenReturn(Mono.just(3));
            when(userRepository.deleteById(8L)).thenReturn(Mono.empty());

            StepVerifier.create(adminService.deleteUser(8L, admin)).verifyComplete();

            InOrder order = inOrder(projectService);
            order.verify(projectService).deleteProjectGraph(70L);
            order.verify(projectService).deleteProjectGraph(71L);
            verify(shareRepository).detachUser(8L);
            verify(userRepository).deleteById(8L);
        }
    }

    @Nested
    @DisplayName("featuring")
    class Featuring {

        @Test
        @DisplayName("Should clear other featured projects before featuring one")
        void shouldFeatureExclusively() {
            LocalDateTime now = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);
            when(projectRepository.findById(7L)).thenReturn(Mono.just(Project.builder().id(7L).build()));
            when(projectRepository.unfeatureAllExcept(7L, now)).thenReturn(Mono.just(1));
            when(projectRepository.updateFeatured(7L, true, now)).thenReturn(Mono.just(1));

            StepVerifier.create(adminService.featureProject(7L)).verifyComplete();

            verify(projectRepository).unfeatureAllExcept(7L, now);
            verify(projectRepository).updateFeatured(7L, true, now);
        }

        @Test
        @DisplayName("Should fail with 404 when unfeaturing a missing project")
        void shouldFailUnfeatureForMissingProject() {
            when(projectRepository.updateFeatured(eq(9L), eq(false), any(LocalDateTime.class))).thenReturn(Mono.just(0));

            StepVerifier.create(adminService.unfeatureProject(9L))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("updateRole")
    class UpdateRole {

        @Test
        @DisplayName("Should reject unknown roles without touching the database")
        void shouldRejectInvalidRole() {
            StepVerifier.create(adminService.updateRole(8L, "superuser"))
                    .expectErrorMessage("error.invalid_role")
                    .verify();

            verify(userRepository, never()).updateRole(anyLong(), anyString());
        }

        @Test
        @DisplayName("Should store the role in lower case")
        void shouldUpdateRole() {
            when(userRepository.updateRole(8L, "admin")).thenReturn(Mono.just(1));
            when(userRepository.findById(8L))
                    .thenReturn(Mono.just(User.builder().id(8L).username("bob").role("admin").build()));

            StepVerifier.create(adminService.updateRole(8L, "ADMIN"))
                    .assertNext(user -> assertThat(user.getRole()).isEqualTo("admin"))
                    .verifyComplete();
        }
    }
}
