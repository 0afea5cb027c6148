package com.eventstorming.core.model;

/**
 * Response granularity for element listings.
 */
public enum DetailLevel {
    /** id, type, name, position and bounded context id only. */
    SUMMARY,
    /** Every element field. */
    FULL
}
