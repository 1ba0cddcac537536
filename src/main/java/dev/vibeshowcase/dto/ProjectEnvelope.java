package dev.vibeshowcase.dto;

/**
 * {@code {"project": ...}}; {@code project} is serialized as null when absent.
 */
public record ProjectEnvelope(ProjectResponse project) {
}
