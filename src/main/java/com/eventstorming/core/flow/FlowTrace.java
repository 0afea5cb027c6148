package com.eventstorming.core.flow;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of a flow trace.
 *
 * @param workshopName   workshop name
 * @param startElementId the requested start, or {@code null} for an all-roots trace
 * @param branches       one branch per traversal start, in trace order
 * @param rootCount      roots found in all-roots mode (1 for a directed trace)
 * @param visitedCount   nodes counted against the budget
 * @param maxElements    the budget
 * @param truncated      whether the budget was exhausted
 */
public record FlowTrace(
    String workshopName,
    String startElementId,
    List<Branch> branches,
    int rootCount,
    int visitedCount,
    int maxElements,
    boolean truncated
) {

    /**
     * Tree traced from one start.
     *
     * @param startId   start element id
     * @param startName start element name
     * @param nodes     the start node (or a marker), empty when the start was skipped
     */
    public record Branch(String startId, String startName, List<FlowNode> nodes) {}

    public boolean directed() {
        return startElementId != null;
    }

    /**
     * Ids of every element shown anywhere in the trace, in first-seen order.
     */
    public Set<String> visitedElementIds() {
        Set<String> ids = new LinkedHashSet<>();
        List<FlowNode> pending = new ArrayList<>();
        for (Branch branch : branches) {
            pending.addAll(branch.nodes());
        }
        while (!pending.isEmpty()) {
            FlowNode node = pending.remove(0);
            if (!node.limitMarker()) {
                ids.add(node.elementId());
            }
            pending.addAll(0, node.children());
        }
        return ids;
    }
}
