package com.eventstorming.core.stats;

import com.eventstorming.core.model.ElementType;

import java.util.Map;

/**
 * Counts and coverage derived from one workshop snapshot.
 *
 * @param workshopName   workshop name
 * @param domain         workshop domain
 * @param createdAt      workshop creation time
 * @param updatedAt      workshop last save time
 * @param totalElements  number of elements
 * @param totalContexts  number of bounded contexts
 * @param byType         count per element type, all types present
 * @param byContext      member count per context name; the last of several same-name contexts wins
 * @param relationships  trigger edge metrics
 * @param coverage       context assignment metrics
 */
public record WorkshopStatistics(
    String workshopName,
    String domain,
    String createdAt,
    String updatedAt,
    int totalElements,
    int totalContexts,
    Map<ElementType, Integer> byType,
    Map<String, Integer> byContext,
    Relationships relationships,
    Coverage coverage
) {

    /**
     * @param elementsWithTriggers    elements with at least one outgoing trigger
     * @param elementsWithTriggeredBy elements with at least one incoming trigger
     * @param totalTriggerLinks       sum of all outgoing trigger list lengths
     */
    public record Relationships(int elementsWithTriggers, int elementsWithTriggeredBy, int totalTriggerLinks) {}

    /**
     * @param elementsInContexts     elements with a bounded context id
     * @param elementsWithoutContext elements without one
     * @param percentContextualized  share of elements with a context, 0..100; 0 for an empty workshop
     */
    public record Coverage(int elementsInContexts, int elementsWithoutContext, double percentContextualized) {}
}
