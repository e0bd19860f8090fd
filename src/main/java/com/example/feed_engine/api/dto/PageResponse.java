package com.example.feed_engine.api.dto;

import java.util.List;

/**
 * Growing feed window handed to the presentation layer.
 *
 * @param content  items shown so far, in ranked order.
 * @param pages    number of pages the window covers.
 * @param size     page size.
 * @param total    length of the full ranked sequence.
 * @param hasMore  whether more items exist beyond {@code content}.
 */
public record PageResponse<T>(List<T> content, int pages, int size, long total, boolean hasMore) {
}
