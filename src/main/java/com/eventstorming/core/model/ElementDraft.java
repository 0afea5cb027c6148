package com.eventstorming.core.model;

import java.util.List;

/**
 * Input for creating an element. Only {@code type} and {@code name} are required.
 *
 * @param type             element type
 * @param name             display name
 * @param position         timeline position; {@code null} appends the element to its type lane
 * @param notes            free-text notes
 * @param createdBy        creator name
 * @param triggers         ids of elements this element causes
 * @param triggeredBy      ids of elements that cause this element
 * @param boundedContextId context to join; an unknown id is stored as-is
 */
public record ElementDraft(
    ElementType type,
    String name,
    Integer position,
    String notes,
    String createdBy,
    List<String> triggers,
    List<String> triggeredBy,
    String boundedContextId
) {

    public ElementDraft {
        if (type == null) {
            throw new WorkshopValidationException("Element type is required");
        }
        if (name == null || name.isBlank()) {
            throw new WorkshopValidationException("Element name is required");
        }
        if (position != null && position < 0) {
            throw new WorkshopValidationException("Position must be >= 0, got " + position);
        }
        name = name.strip();
        triggers = triggers != null ? List.copyOf(triggers) : List.of();
        triggeredBy = triggeredBy != null ? List.copyOf(triggeredBy) : List.of();
    }

    public static ElementDraft of(ElementType type, String name) {
        return new ElementDraft(type, name, null, null, null, null, null, null);
    }
}
