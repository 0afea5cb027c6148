package com.eventstorming.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A typed node of the domain graph.
 * <p>
 * {@code triggers} and {@code triggeredBy} are the outgoing and incoming trigger
 * edges by element id. {@code boundedContextId} is a weak reference to a
 * {@link BoundedContext}; the context keeps the inverse list in
 * {@link BoundedContext#getElementIds()}.
 */
public class Element {

    private String id;
    private ElementType type;
    private String name;
    private int position;
    private String notes = "";
    private String createdAt;
    private String updatedAt;
    private String createdBy = "";
    private List<String> triggers = new ArrayList<>();
    private List<String> triggeredBy = new ArrayList<>();
    private String boundedContextId;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public ElementType getType() { return type; }
    public void setType(ElementType type) { this.type = type; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public int getPosition() { return position; }
    public void setPosition(int position) { this.position = position; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes != null ? notes : ""; }
    public String getCreatedAt() { return createdAt; }
    public void setCreatedAt(String createdAt) { this.createdAt = createdAt; }
    public String getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(String updatedAt) { this.updatedAt = updatedAt; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy != null ? createdBy : ""; }
    public List<String> getTriggers() { return triggers; }
    public void setTriggers(List<String> triggers) {
        this.triggers = triggers != null ? new ArrayList<>(triggers) : new ArrayList<>();
    }
    public List<String> getTriggeredBy() { return triggeredBy; }
    public void setTriggeredBy(List<String> triggeredBy) {
        this.triggeredBy = triggeredBy != null ? new ArrayList<>(triggeredBy) : new ArrayList<>();
    }
    public String getBoundedContextId() { return boundedContextId; }
    public void setBoundedContextId(String boundedContextId) { this.boundedContextId = boundedContextId; }

    public boolean hasContext() {
        return boundedContextId != null && !boundedContextId.isEmpty();
    }
}
