package com.eventstorming.core.model;

import java.util.List;

/**
 * Partial update of an element. A {@code null} component leaves the field unchanged.
 * A {@code boundedContextId} equal to {@link #CLEAR_CONTEXT} removes the assignment.
 */
public record ElementPatch(
    String name,
    Integer position,
    String notes,
    List<String> triggers,
    List<String> triggeredBy,
    String boundedContextId
) {

    public static final String CLEAR_CONTEXT = "null";

    public ElementPatch {
        if (name != null && name.isBlank()) {
            throw new WorkshopValidationException("Element name must not be blank");
        }
        if (position != null && position < 0) {
            throw new WorkshopValidationException("Position must be >= 0, got " + position);
        }
        triggers = triggers != null ? List.copyOf(triggers) : null;
        triggeredBy = triggeredBy != null ? List.copyOf(triggeredBy) : null;
    }

    public boolean isEmpty() {
        return name == null && position == null && notes == null
                && triggers == null && triggeredBy == null && boundedContextId == null;
    }
}
