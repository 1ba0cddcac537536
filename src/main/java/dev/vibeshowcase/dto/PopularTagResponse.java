package dev.vibeshowcase.dto;

public record PopularTagResponse(String name, long count) {
}
