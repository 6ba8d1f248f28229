package me.go_gradually.ceddy.application.shared.model;

public record PageQuery(int limit, int offset) {
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public PageQuery {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
    }

    public static PageQuery of(int limit, int offset) {
        return new PageQuery(limit, offset);
    }

    public static PageQuery firstPage() {
        return new PageQuery(DEFAULT_LIMIT, 0);
    }
}
