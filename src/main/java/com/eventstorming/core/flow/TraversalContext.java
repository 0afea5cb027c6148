package com.eventstorming.core.flow;

import java.util.HashSet;
import java.util.Set;

/**
 * Mutable state of one flow trace call.
 * <p>
 * The element budget is shared by every start of the call. The visited-set
 * belongs to the current start only and is replaced by {@link #beginTraversal()}.
 */
final class TraversalContext {

    private final int maxDepth;
    private final int maxElements;
    private int visitedCount;
    private Set<String> visited = new HashSet<>();

    TraversalContext(int maxDepth, int maxElements) {
        this.maxDepth = maxDepth;
        this.maxElements = maxElements;
    }

    void beginTraversal() {
        visited = new HashSet<>();
    }

    boolean exhausted() {
        return visitedCount >= maxElements;
    }

    boolean beyondDepth(int depth) {
        return depth >= maxDepth;
    }

    boolean seen(String elementId) {
        return visited.contains(elementId);
    }

    void visit(String elementId) {
        visited.add(elementId);
        visitedCount++;
    }

    int visitedCount() {
        return visitedCount;
    }

    int maxElements() {
        return maxElements;
    }
}
