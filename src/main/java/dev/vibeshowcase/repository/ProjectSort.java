package dev.vibeshowcase.repository;

import java.util.Locale;

/**
 * Listing sort modes. {@link #TRENDING} is ranked in the application, the others in SQL.
 */
public enum ProjectSort {
    TRENDING("p.created_at DESC, p.id DESC"),
    LATEST("p.created_at DESC, p.id DESC"),
    POPULAR("p.views_count DESC, p.id DESC"),
    FEATURED("p.created_at DESC, p.id DESC");

    private final String orderBy;

    ProjectSort(String orderBy) {
        this.orderBy = orderBy;
    }

    public String orderBy() {
        return orderBy;
    }

    /**
     * Parses a {@code sort} query parameter; missing or unknown values mean {@link #TRENDING}.
     */
    public static ProjectSort fromParam(String value) {
        if (value == null || value.isBlank()) {
            return TRENDING;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return TRENDING;
        }
    }
}
