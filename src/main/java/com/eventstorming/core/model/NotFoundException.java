package com.eventstorming.core.model;

/**
 * Thrown when a workshop, element or bounded context id does not exist.
 */
public class NotFoundException extends RuntimeException {

    /**
     * What kind of entity was looked up.
     */
    public enum Kind {
        WORKSHOP("Workshop"),
        ELEMENT("Element"),
        CONTEXT("Bounded context"),
        START_ELEMENT("Start element");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind kind;
    private final String id;

    public NotFoundException(Kind kind, String id) {
        super(kind.label() + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public Kind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }
}
