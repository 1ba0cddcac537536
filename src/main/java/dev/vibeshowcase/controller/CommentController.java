package dev.vibeshowcase.controller;

import dev.vibeshowcase.dto.CommentEnvelope;
import dev.vibeshowcase.dto.CommentPageResponse;
import dev.vibeshowcase.dto.CommentRequest;
import dev.vibeshowcase.dto.LikeResponse;
import dev.vibeshowcase.dto.PageParams;
import dev.vibeshowcase.dto.ReplyEnvelope;
import dev.vibeshowcase.security.CurrentViewer;
import dev.vibeshowcase.service.CommentService;
import dev.vibeshowcase.util.PathIds;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Comments", description = "Project comments, replies and their likes")
@Slf4j
public class CommentController {

    static final int DEFAULT_COMMENT_LIMIT = 10;

    private final CommentService commentService;
    private final CurrentViewer currentViewer;

    @GetMapping("/projects/{id}/comments")
    @Operation(summary = "List comments", description = "Paginated comments of a project, each with its replies")
    public Mono<CommentPageResponse> listComments(
            @PathVariable String id,
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String limit,
            @Parameter(description = "newest, oldest or mostLiked") @RequestParam(required = false) String sort) {
        long projectId = PathIds.parse(id);
        PageParams pageParams = PageParams.parse(page, limit, DEFAULT_COMMENT_LIMIT);
        return currentViewer.get()
                .flatMap(viewer -> commentService.listComments(projectId, pageParams, sort, viewer));
    }

    @PostMapping("/projects/{id}/comments")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Add comment")
    public Mono<CommentEnvelope> addComment(@PathVariable String id, @Valid @RequestBody CommentRequest request) {
        long projectId = PathIds.parse(id);
        return currentViewer.require()
                .flatMap(viewer -> commentService.addComment(projectId, request.content(), viewer))
                .map(CommentEnvelope::new);
    }

    @PostMapping("/comments/{id}/replies")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Reply to comment")
    public Mono<ReplyEnvelope> addReply(@PathVariable String id, @Valid @RequestBody CommentRequest request) {
        long commentId = PathIds.parse(id);
        return currentViewer.require()
                .flatMap(viewer -> commentService.addReply(commentId, request.content(), viewer))
                .map(ReplyEnvelope::new);
    }

    @PostMapping("/comments/{id}/like")
    @Operation(summary = "Like comment")
    public Mono<LikeResponse> likeComment(@PathVariable String id) {
        long commentId = PathIds.parse(id);
        return currentViewer.require().flatMap(viewer -> commentService.likeComment(commentId, viewer));
    }

    @DeleteMapping("/comments/{id}/like")
    @Operation(summary = "Unlike comment")
    public Mono<LikeResponse> unlikeComment(@PathVariable String id) {
        long commentId = PathIds.parse(id);
        return currentViewer.require().flatMap(viewer -> commentService.unlikeComment(commentId, viewer));
    }

    @PostMapping("/replies/{id}/like")
    @Operation(summary = "Like reply")
    public Mono<LikeResponse> likeReply(@PathVariable String id) {
        long replyId = PathIds.parse(id);
        return currentViewer.require().flatMap(viewer -> commentService.likeReply(replyId, viewer));
    }

    @DeleteMapping("/replies/{id}/like")
    @Operation(summary = "Unlike reply")
    public Mono<LikeResponse> unlikeReply(@PathVariable String id) {
        long replyId = PathIds.parse(id);
        return currentViewer.require().flatMap(viewer -> commentService.unlikeReply(replyId, viewer));
    }
}
