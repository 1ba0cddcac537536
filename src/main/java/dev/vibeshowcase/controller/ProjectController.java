package dev.vibeshowcase.controller;

import dev.vibeshowcase.dto.BookmarkResponse;
import dev.vibeshowcase.dto.LikeResponse;
import dev.vibeshowcase.dto.MessageResponse;
import dev.vibeshowcase.dto.PageParams;
import dev.vibeshowcase.dto.ProjectEnvelope;
import dev.vibeshowcase.dto.ProjectListResponse;
import dev.vibeshowcase.dto.ProjectPageResponse;
import dev.vibeshowcase.dto.ProjectRequest;
import dev.vibeshowcase.dto.ProjectUpdateRequest;
import dev.vibeshowcase.dto.ShareRequest;
import dev.vibeshowcase.dto.ShareResponse;
import dev.vibeshowcase.security.CurrentViewer;
import dev.vibeshowcase.service.ProjectQuery;
import dev.vibeshowcase.service.ProjectService;
import dev.vibeshowcase.util.PathIds;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Project listing, detail, lifecycle and engagement endpoints.
 * Ids arrive as strings so a malformed id is answered with 400.
 */
@RestController
@RequestMapping("/api")
@Validated
@RequiredArgsConstructor
@Tag(name = "Projects", description = "Project discovery and engagement")
@Slf4j
public class ProjectController {

    static final int DEFAULT_TRENDING_LIMIT = 4;

    private final ProjectService projectService;
    private final CurrentViewer currentViewer;

    @Value("${app.listing.default-limit:6}")
    private int defaultLimit = 6;

    @GetMapping("/projects")
    @Operation(summary = "List projects", description = "Filtered, sorted and paginated project listing")
    public Mono<ProjectPageResponse> listProjects(
            @Parameter(description = "Page number (1-based)") @RequestParam(required = false) String page,
            @Parameter(description = "Page size (max 100)") @RequestParam(required = false) String limit,
            @RequestParam(required = false) String tag,
            @RequestParam(required = false) String search,
            @Parameter(description = "trending, latest, popular or featured") @RequestParam(required = false) String sort,
            @Parameter(description = "Author username") @RequestParam(required = false) String user) {
        PageParams pageParams = PageParams.parse(page, limit, defaultLimit);
        ProjectQuery query = ProjectQuery.of(tag, search, user, sort);
        log.debug("Listing projects: {} page={} limit={}", query, pageParams.page(), pageParams.limit());
        return currentViewer.get()
                .flatMap(viewer -> projectService.listProjects(query, pageParams, viewer));
    }

    @GetMapping("/projects/featured")
    @Operation(summary = "Featured project", description = "The newest featured project, or null")
    public Mono<ProjectEnvelope> getFeatured() {
        return currentViewer.get().flatMap(projectService::getFeatured);
    }

    @GetMapping("/projects/trending")
    @Operation(summary = "Trending projects")
    public Mono<ProjectListResponse> getTrending(@RequestParam(required = false) String limit) {
        int size = PageParams.parse(null, limit, DEFAULT_TRENDING_LIMIT).limit();
        return currentViewer.get().flatMap(viewer -> projectService.getTrending(size, viewer));
    }

    @GetMapping("/projects/{id}")
    @Operation(summary = "Get project", description = "Project detail with gallery; counts a view")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Project found"),
            @ApiResponse(responseCode = "400", description = "Malformed id"),
            @ApiResponse(responseCode = "404", description = "Project not found or private")
    })
    public Mono<ProjectEnvelope> getProject(@PathVariable String id) {
        long projectId = PathIds.parse(id);
        return currentViewer.get().flatMap(viewer -> projectService.getProject(projectId, viewer));
    }

    @PostMapping("/projects/{id}/view")
    @Operation(summary = "Record project view")
    public Mono<MessageResponse> recordView(@PathVariable String id) {
        long projectId = PathIds.parse(id);
        return currentViewer.get()
                .flatMap(viewer -> projectService.recordView(projectId, viewer))
                .thenReturn(MessageResponse.of("View recorded"));
    }

    @PostMapping("/projects")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create project")
    public Mono<ProjectEnvelope> createProject(@Valid @RequestBody ProjectRequest request) {
        return currentViewer.require()
                .flatMap(viewer -> projectService.createProject(request, viewer))
                .map(ProjectEnvelope::new);
    }

    @PutMapping("/projects/{id}")
    @Operation(summary = "Update project", description = "Author or admin only")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Project updated"),
            @ApiResponse(responseCode = "403", description = "Not the author"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    public Mono<ProjectEnvelope> updateProject(@PathVariable String id, @Valid @RequestBody ProjectUpdateRequest request) {
        long projectId = PathIds.parse(id);
        return currentViewer.require()
                .flatMap(viewer -> projectService.updateProject(projectId, request, viewer))
                .map(ProjectEnvelope::new);
    }

    @DeleteMapping("/projects/{id}")
    @Operation(summary = "Delete project", description = "Author or admin only")
    public Mono<MessageResponse> deleteProject(@PathVariable String id) {
        long projectId = PathIds.parse(id);
        return currentViewer.require()
                .flatMap(viewer -> projectService.deleteProject(projectId, viewer))
                .thenReturn(MessageResponse.of("Project deleted successfully"));
    }

    @PostMapping("/projects/{id}/like")
    @Operation(summary = "Like project")
    public Mono<LikeResponse> like(@PathVariable String id) {
        long projectId = PathIds.parse(id);
        return currentViewer.require().flatMap(viewer -> projectService.like(projectId, viewer));
    }

    @DeleteMapping("/projects/{id}/like")
    @Operation(summary = "Unlike project")
    public Mono<LikeResponse> unlike(@PathVariable String id) {
        long projectId = PathIds.parse(id);
        return currentViewer.require().flatMap(viewer -> projectService.unlike(projectId, viewer));
    }

    @PostMapping("/projects/{id}/bookmark")
    @Operation(summary = "Bookmark project")
    public Mono<BookmarkResponse> bookmark(@PathVariable String id) {
        long projectId = PathIds.parse(id);
        return currentViewer.require().flatMap(viewer -> projectService.bookmark(projectId, viewer));
    }

    @DeleteMapping("/projects/{id}/bookmark")
    @Operation(summary = "Remove bookmark")
    public Mono<BookmarkResponse> unbookmark(@PathVariable String id) {
        long projectId = PathIds.parse(id);
        return currentViewer.require().flatMap(viewer -> projectService.unbookmark(projectId, viewer));
    }

    @GetMapping("/bookmarks")
    @Operation(summary = "Bookmarked projects of the current user")
    public Mono<ProjectListResponse> getBookmarks() {
        return currentViewer.require().flatMap(projectService::getBookmarks);
    }

    @PostMapping("/projects/{id}/share")
    @Operation(summary = "Share project", description = "Counts a share on the given platform")
    public Mono<ShareResponse> share(@PathVariable String id, @Valid @RequestBody ShareRequest request) {
        long projectId = PathIds.parse(id);
        return currentViewer.get().flatMap(viewer -> projectService.share(projectId, request.platform(), viewer));
    }
}
