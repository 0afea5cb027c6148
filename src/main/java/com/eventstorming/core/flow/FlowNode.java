package com.eventstorming.core.flow;

import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.ElementType;

import java.util.List;

/**
 * One line of a traced flow: either a visited element with the nodes it
 * triggers, or a marker showing that the element budget ran out at this point.
 *
 * @param elementId   visited element id, {@code null} for a marker
 * @param type        element type, {@code null} for a marker
 * @param name        element name, {@code null} for a marker
 * @param notes       element notes
 * @param depth       hops from the traversal's start
 * @param children    nodes reached through this element's triggers
 * @param limitMarker true if this is a budget-exhausted marker
 */
public record FlowNode(
    String elementId,
    ElementType type,
    String name,
    String notes,
    int depth,
    List<FlowNode> children,
    boolean limitMarker
) {

    static FlowNode of(Element element, int depth, List<FlowNode> children) {
        return new FlowNode(element.getId(), element.getType(), element.getName(),
                element.getNotes(), depth, List.copyOf(children), false);
    }

    static FlowNode marker(int depth) {
        return new FlowNode(null, null, null, null, depth, List.of(), true);
    }
}
