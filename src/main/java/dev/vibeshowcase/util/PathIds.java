package dev.vibeshowcase.util;

/**
 * Parses numeric ids taken from request paths. Anything that is not a positive number is a
 * bad request rather than a missing resource.
 */
public final class PathIds {

    private PathIds() {
    }

    public static long parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("error.invalid_id");
        }
        try {
            long id = Long.parseLong(raw.trim());
            if (id <= 0) {
                throw new IllegalArgumentException("error.invalid_id");
            }
            return id;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("error.invalid_id", e);
        }
    }
}
