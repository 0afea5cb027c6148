package com.eventstorming.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The sticky-note kinds of an event storming board.
 * <p>
 * Each type is serialized by its lower snake case wire name and carries the
 * traditional note color used when rendering the board.
 */
public enum ElementType {
    EVENT("event", "orange"),
    COMMAND("command", "blue"),
    ACTOR("actor", "yellow"),
    AGGREGATE("aggregate", "pale_yellow"),
    POLICY("policy", "lilac"),
    READ_MODEL("read_model", "green"),
    EXTERNAL_SYSTEM("external_system", "pink"),
    HOTSPOT("hotspot", "red");

    private final String wireName;
    private final String color;

    ElementType(String wireName, String color) {
        this.wireName = wireName;
        this.color = color;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String color() {
        return color;
    }

    /**
     * Resolves a type from its wire name or enum constant name, case-insensitively.
     *
     * @throws WorkshopValidationException if the value names no type
     */
    @JsonCreator
    public static ElementType fromWireName(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (ElementType type : values()) {
                if (type.wireName.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                    return type;
                }
            }
        }
        throw new WorkshopValidationException("Unknown element type: " + value);
    }
}
