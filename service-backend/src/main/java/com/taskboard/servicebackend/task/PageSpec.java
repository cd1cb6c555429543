package com.taskboard.servicebackend.task;

/**
 * A 1-based page request. Out-of-range input is clamped to defaults, never rejected.
 */
public record PageSpec(int page, int limit) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public PageSpec {
        if (page < 1) {
            page = DEFAULT_PAGE;
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static PageSpec first() {
        return new PageSpec(DEFAULT_PAGE, DEFAULT_LIMIT);
    }

    /**
     * Parses raw query parameters; anything that is not an integer falls back to the default.
     */
    public static PageSpec parse(String page, String limit) {
        return new PageSpec(parseOr(page, DEFAULT_PAGE), parseOr(limit, DEFAULT_LIMIT));
    }

    /** Rows skipped before this page; a {@code long} since any positive page number is accepted. */
    public long offset() {
        return (long) (page - 1) * limit;
    }

    private static int parseOr(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
