package dev.vibeshowcase.repository;

import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Monthly view aggregates in {@code project_views}, keyed by (project, month, year).
 */
public interface ProjectViewRepository {

    /**
     * Adds one view to the project's row for the month, creating the row on first view.
     * Single statement, safe under concurrent views.
     */
    Mono<Void> incrementMonthly(long rowId, long projectId, int month, int year, LocalDateTime now);

    Mono<Void> deleteByProjectId(long projectId);
}
