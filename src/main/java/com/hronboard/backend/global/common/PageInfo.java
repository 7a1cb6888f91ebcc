package com.hronboard.backend.global.common;

/**
 * Pagination block returned by list endpoints. {@code page} is 1-based.
 */
public record PageInfo(int page, int limit, long total, int pages) {

    public static PageInfo of(int page, int limit, long total) {
        int pages = limit <= 0 ? 0 : (int) ((total + limit - 1) / limit);
        return new PageInfo(page, limit, total, pages);
    }
}
