package dev.vibeshowcase.repository;

public record TagLink(long projectId, String tagName) {
}
