package com.appreview.api;

import java.util.List;
import java.util.function.Function;

/**
 * A page of results from a paginated query.
 *
 * @param content       the content of this page (defensive copy)
 * @param totalElements total number of elements across all pages
 * @param pageNumber    the current page number (0-based)
 * @param pageSize      the requested page size
 * @param <T>           the element type
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    /**
     * Slices a fully materialized, already ordered list.
     */
    public static <T> Page<T> of(List<T> all, PageRequest request) {
        int total = all.size();
        int from = Math.min(request.offset(), total);
        int to = Math.min(from + request.size(), total);
        return new Page<>(all.subList(from, to), total, request.page(), request.size());
    }

    public <R> Page<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = content.stream().<R>map(mapper).toList();
        return new Page<>(mapped, totalElements, pageNumber, pageSize);
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public int numberOfElements() {
        return content.size();
    }
}
