package dev.vibeshowcase.dto;

public record ShareResponse(boolean success, int sharesCount) {
}
