package dev.vibeshowcase.dto;

import java.util.List;

/**
 * One page of a project listing.
 */
public record ProjectPageResponse(List<ProjectResponse> projects, boolean hasMore, long total) {

    public static ProjectPageResponse empty() {
        return new ProjectPageResponse(List.of(), false, 0);
    }

    public static ProjectPageResponse of(List<ProjectResponse> projects, long offset, long total) {
        return new ProjectPageResponse(projects, offset + projects.size() < total, total);
    }
}
