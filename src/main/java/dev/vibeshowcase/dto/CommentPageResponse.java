package dev.vibeshowcase.dto;

import java.util.List;

public record CommentPageResponse(List<CommentResponse> comments, boolean hasMore, long totalComments) {

    public static CommentPageResponse of(List<CommentResponse> comments, long offset, long total) {
        return new CommentPageResponse(comments, offset + comments.size() < total, total);
    }
}
