package dev.vibeshowcase.dto;

/**
 * Page/limit query parameters. Parsing is lenient on purpose: missing, non-numeric,
 * zero or negative values fall back to the defaults instead of failing the request,
 * and the limit is capped.
 */
public record PageParams(int page, int limit) {

    public static final int MAX_LIMIT = 100;

    public static PageParams parse(String page, String limit, int defaultLimit) {
        return new PageParams(parsePositive(page, 1), Math.min(parsePositive(limit, defaultLimit), MAX_LIMIT));
    }

    public long offset() {
        return (long) (page - 1) * limit;
    }

    static int parsePositive(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
