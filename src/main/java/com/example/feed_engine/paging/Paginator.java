package com.example.feed_engine.paging;

import com.example.feed_engine.api.dto.PageResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Turns a fully ranked list into bounded windows.
 */
public final class Paginator {
    public static final int DEFAULT_PAGE_SIZE = 20;

    private Paginator() {
    }

    /**
     * Returns the prefix covering the first {@code pageCount} pages.
     *
     * @param ordered   fully ordered sequence.
     * @param pageSize  items per page, must be positive.
     * @param pageCount pages requested, must not be negative.
     * @return prefix of length {@code min(pageSize * pageCount, total)} and whether more is available.
     */
    public static <T> PageResponse<T> window(List<T> ordered, int pageSize, int pageCount) {
        Objects.requireNonNull(ordered, "ordered");
        requireValid(pageSize, pageCount);
        int total = ordered.size();
        int end = (int) Math.min((long) pageSize * pageCount, total);
        List<T> content = Collections.unmodifiableList(new ArrayList<>(ordered.subList(0, end)));
        return new PageResponse<>(content, pageCount, pageSize, total, end < total);
    }

    /**
     * Returns a single page, {@code pageIndex} counted from zero.
     */
    public static <T> List<T> page(List<T> ordered, int pageSize, int pageIndex) {
        Objects.requireNonNull(ordered, "ordered");
        requireValid(pageSize, pageIndex);
        long from = (long) pageSize * pageIndex;
        if (from >= ordered.size()) {
            return List.of();
        }
        int to = (int) Math.min(from + pageSize, ordered.size());
        return Collections.unmodifiableList(new ArrayList<>(ordered.subList((int) from, to)));
    }

    private static void requireValid(int pageSize, int pages) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive, got " + pageSize);
        }
        if (pages < 0) {
            throw new IllegalArgumentException("page count must not be negative, got " + pages);
        }
    }
}
