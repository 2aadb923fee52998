package com.example.reviewbot.service;

import java.util.List;

/**
 * One page of an in-memory list. Pages are 1-based; an out-of-range page is clamped.
 */
public record PageSlice<T>(List<T> items, int page, int totalPages, int totalItems) {

    public static <T> PageSlice<T> of(List<T> all, int page, int pageSize) {
        int totalPages = Math.max(1, (all.size() + pageSize - 1) / pageSize);
        int current = Math.min(Math.max(page, 1), totalPages);
        int from = (current - 1) * pageSize;
        int to = Math.min(from + pageSize, all.size());
        return new PageSlice<>(List.copyOf(all.subList(from, to)), current, totalPages, all.size());
    }
}
