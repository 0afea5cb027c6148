package com.eventstorming.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A named DDD sub-boundary grouping elements.
 * <p>
 * {@code elementIds} mirrors the elements whose {@code boundedContextId} is this
 * context. It is kept in step by the mutation operations, never derived on read.
 */
public class BoundedContext {

    private String id;
    private String name;
    private String description = "";
    private List<String> elementIds = new ArrayList<>();
    private String color;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description != null ? description : ""; }
    public List<String> getElementIds() { return elementIds; }
    public void setElementIds(List<String> elementIds) {
        this.elementIds = elementIds != null ? new ArrayList<>(elementIds) : new ArrayList<>();
    }
    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    /**
     * Appends a member id unless it is already present.
     *
     * @return true if the id was added
     */
    public boolean addMember(String elementId) {
        if (elementIds.contains(elementId)) {
            return false;
        }
        return elementIds.add(elementId);
    }

    /**
     * Removes every occurrence of a member id.
     *
     * @return true if anything was removed
     */
    public boolean removeMember(String elementId) {
        return elementIds.removeIf(elementId::equals);
    }
}
