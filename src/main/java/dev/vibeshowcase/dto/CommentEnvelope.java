package dev.vibeshowcase.dto;

public record CommentEnvelope(CommentResponse comment) {
}
