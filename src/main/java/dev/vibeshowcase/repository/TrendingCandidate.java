package dev.vibeshowcase.repository;

import java.time.LocalDateTime;

/**
 * The inputs the trending score needs for one project.
 */
public record TrendingCandidate(long projectId, LocalDateTime createdAt, long monthlyViews) {
}
