package dev.vibeshowcase.controller;

import dev.vibeshowcase.dto.CommentResponse;
import dev.vibeshowcase.dto.MessageResponse;
import dev.vibeshowcase.dto.ProjectResponse;
import dev.vibeshowcase.dto.RoleUpdateRequest;
import dev.vibeshowcase.dto.UserResponse;
import dev.vibeshowcase.security.CurrentViewer;
import dev.vibeshowcase.service.AdminService;
import dev.vibeshowcase.util.PathIds;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin", description = "Moderation endpoints")
@Slf4j
public class AdminController {

    private final AdminService adminService;
    private final CurrentViewer currentViewer;

    @GetMapping("/users")
    @Operation(summary = "List users", description = "Newest first")
    public Mono<List<UserResponse>> getUsers() {
        return adminService.getUsers();
    }

    @GetMapping("/projects")
    @Operation(summary = "List projects", description = "Every project, private ones included")
    public Mono<List<ProjectResponse>> getProjects() {
        return currentViewer.require().flatMap(adminService::getProjects);
    }

    @GetMapping("/comments")
    @Operation(summary = "Recent comments")
    public Mono<List<CommentResponse>> getRecentComments() {
        return adminService.getRecentComments();
    }

    @DeleteMapping("/users/{id}")
    @Operation(summary = "Delete user", description = "Removes the user with their projects and engagement")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "User deleted"),
            @ApiResponse(responseCode = "400", description = "Attempt to delete own account"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    public Mono<MessageResponse> deleteUser(@PathVariable String id) {
        long userId = PathIds.parse(id);
        log.info("Admin deleting user {}", userId);
        return currentViewer.require()
                .flatMap(admin -> adminService.deleteUser(userId, admin))
                .thenReturn(MessageResponse.of("User deleted successfully"));
    }

    @DeleteMapping("/projects/{id}")
    @Operation(summary = "Delete project")
    public Mono<MessageResponse> deleteProject(@PathVariable String id) {
        long projectId = PathIds.parse(id);
        return currentViewer.require()
                .flatMap(admin -> adminService.deleteProject(projectId, admin))
                .thenReturn(MessageResponse.of("Project deleted successfully"));
    }

    @DeleteMapping("/comments/{id}")
    @Operation(summary = "Delete comment")
    public Mono<MessageResponse> deleteComment(@PathVariable String id) {
        long commentId = PathIds.parse(id);
        return currentViewer.require()
                .flatMap(admin -> adminService.deleteComment(commentId, admin))
                .thenReturn(MessageResponse.of("Comment deleted successfully"));
    }

    @PutMapping("/projects/{id}/feature")
    @Operation(summary = "Feature project", description = "Unfeatures every other project")
    public Mono<MessageResponse> featureProject(@PathVariable String id) {
        long projectId = PathIds.parse(id);
        return adminService.featureProject(projectId)
                .thenReturn(MessageResponse.of("Project featured"));
    }

    @DeleteMapping("/projects/{id}/feature")
    @Operation(summary = "Unfeature project")
    public Mono<MessageResponse> unfeatureProject(@PathVariable String id) {
        long projectId = PathIds.parse(id);
        return adminService.unfeatureProject(projectId)
                .thenReturn(MessageResponse.of("Project unfeatured"));
    }

    @PutMapping("/users/{id}/role")
    @Operation(summary = "Change user role", description = "Accepts 'admin' or 'user'")
    public Mono<UserResponse> updateRole(@PathVariable String id, @Valid @RequestBody RoleUpdateRequest request) {
        long userId = PathIds.parse(id);
        return adminService.updateRole(userId, request.role());
    }
}
