package com.eventstorming.core.query;

import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.ElementType;

import java.util.function.Predicate;

/**
 * Optional type and context constraints, ANDed together.
 */
public record ElementFilter(ElementType type, String boundedContextId) implements Predicate<Element> {

    public static ElementFilter none() {
        return new ElementFilter(null, null);
    }

    @Override
    public boolean test(Element element) {
        if (type != null && element.getType() != type) {
            return false;
        }
        return boundedContextId == null || boundedContextId.isEmpty()
                || boundedContextId.equals(element.getBoundedContextId());
    }
}
