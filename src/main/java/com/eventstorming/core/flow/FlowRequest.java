package com.eventstorming.core.flow;

import com.eventstorming.core.model.WorkshopValidationException;

/**
 * Parameters of a flow trace.
 *
 * @param startElementId element to trace from; {@code null} traces from every root
 * @param maxDepth       edge hops from each traversal's own start, 1..20
 * @param maxElements    budget of visited nodes for the whole call, 1..500
 */
public record FlowRequest(String startElementId, int maxDepth, int maxElements) {

    public static final int DEFAULT_MAX_DEPTH = 5;
    public static final int DEFAULT_MAX_ELEMENTS = 100;

    public FlowRequest {
        if (maxDepth < 1 || maxDepth > 20) {
            throw new WorkshopValidationException("maxDepth must be between 1 and 20, got " + maxDepth);
        }
        if (maxElements < 1 || maxElements > 500) {
            throw new WorkshopValidationException("maxElements must be between 1 and 500, got " + maxElements);
        }
        if (startElementId != null && startElementId.isBlank()) {
            startElementId = null;
        }
    }

    public static FlowRequest allRoots() {
        return new FlowRequest(null, DEFAULT_MAX_DEPTH, DEFAULT_MAX_ELEMENTS);
    }

    public static FlowRequest from(String startElementId) {
        return new FlowRequest(startElementId, DEFAULT_MAX_DEPTH, DEFAULT_MAX_ELEMENTS);
    }
}
