package dev.vibeshowcase.repository;

/**
 * One row of a {@code GROUP BY} count keyed by an entity id.
 */
public record IdCount(long id, long count) {
}
