package com.eventstorming.core.model;

/**
 * One row of the workshop listing.
 */
public record WorkshopSummary(
    String id,
    String name,
    String domain,
    String createdAt,
    String updatedAt,
    int elementCount,
    int contextCount
) {}
