package dev.vibeshowcase.dto;

public record BookmarkResponse(boolean success, boolean isBookmarked) {
}
