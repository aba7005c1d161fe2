package com.appreview.api;

/**
 * Pagination request: zero-based page number and page size.
 */
public record PageRequest(int page, int size) {

    private static final int MAX_SIZE = 500;

    public PageRequest {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        if (size <= 0 || size > MAX_SIZE) {
            throw new IllegalArgumentException("size must be > 0 and <= " + MAX_SIZE);
        }
    }

    public static PageRequest of(int page, int size) {
        return new PageRequest(page, size);
    }

    public int offset() {
        return page * size;
    }
}
