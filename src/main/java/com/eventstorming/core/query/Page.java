package com.eventstorming.core.query;

import java.util.List;

/**
 * One slice of a filtered, ordered listing.
 */
public record Page<T>(List<T> items, PaginationInfo pagination) {

    /**
     * Cuts the requested page out of the full list.
     * <p>
     * The page number is clamped into {@code [1, max(totalPages, 1)]}, so a
     * request past the end returns the last page and an empty list returns an
     * empty first page.
     */
    public static <T> Page<T> of(List<T> all, PageRequest request) {
        int totalItems = all.size();
        int pageSize = request.pageSize();
        int totalPages = totalItems > 0 ? (totalItems + pageSize - 1) / pageSize : 0;

        int page = Math.max(1, Math.min(request.page(), Math.max(totalPages, 1)));

        int from = Math.min((page - 1) * pageSize, totalItems);
        int to = Math.min(from + pageSize, totalItems);

        var info = new PaginationInfo(page, pageSize, totalItems, totalPages,
                page < totalPages, page > 1);
        return new Page<>(List.copyOf(all.subList(from, to)), info);
    }
}
