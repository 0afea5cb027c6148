package com.eventstorming.core.query;

/**
 * Position of a returned slice within the full listing.
 *
 * @param page       the page actually returned, after clamping
 * @param pageSize   items per page
 * @param totalItems length of the full listing
 * @param totalPages number of pages, 0 for an empty listing
 * @param hasNext    whether a later page exists
 * @param hasPrev    whether an earlier page exists
 */
public record PaginationInfo(
    int page,
    int pageSize,
    int totalItems,
    int totalPages,
    boolean hasNext,
    boolean hasPrev
) {}
