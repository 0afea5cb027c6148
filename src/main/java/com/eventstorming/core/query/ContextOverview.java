package com.eventstorming.core.query;

import com.eventstorming.core.model.BoundedContext;
import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.ElementType;

import java.util.Map;

/**
 * A bounded context with one page of its members.
 *
 * @param context       the context itself
 * @param elements      requested page of member elements
 * @param typeBreakdown member count per element type, every type present
 */
public record ContextOverview(
    BoundedContext context,
    Page<Element> elements,
    Map<ElementType, Integer> typeBreakdown
) {

    public int totalElements() {
        return elements.pagination().totalItems();
    }
}
