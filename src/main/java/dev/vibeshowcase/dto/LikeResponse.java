package dev.vibeshowcase.dto;

public record LikeResponse(boolean success, long likesCount, boolean isLiked) {
}
