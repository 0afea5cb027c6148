package com.eventstorming.core.query;

import com.eventstorming.core.model.WorkshopValidationException;

/**
 * Requested page of a listing.
 *
 * @param page     1-based page number; values past the end are clamped
 * @param pageSize items per page, 1..{@value #MAX_PAGE_SIZE}
 */
public record PageRequest(int page, int pageSize) {

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 200;

    public PageRequest {
        if (page < 1) {
            throw new WorkshopValidationException("Page must be >= 1, got " + page);
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new WorkshopValidationException(
                    "Page size must be between 1 and " + MAX_PAGE_SIZE + ", got " + pageSize);
        }
    }

    public static PageRequest firstPage() {
        return new PageRequest(1, DEFAULT_PAGE_SIZE);
    }
}
