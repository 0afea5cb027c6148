package com.eventstorming.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Aggregate root of an event storming session: metadata, the ordered element
 * collection and the bounded contexts. One instance is one loaded snapshot.
 */
public class Workshop {

    private WorkshopMetadata metadata;
    private List<Element> elements = new ArrayList<>();
    private List<BoundedContext> boundedContexts = new ArrayList<>();

    public WorkshopMetadata getMetadata() { return metadata; }
    public void setMetadata(WorkshopMetadata metadata) { this.metadata = metadata; }
    public List<Element> getElements() { return elements; }
    public void setElements(List<Element> elements) {
        this.elements = elements != null ? new ArrayList<>(elements) : new ArrayList<>();
    }
    public List<BoundedContext> getBoundedContexts() { return boundedContexts; }
    public void setBoundedContexts(List<BoundedContext> boundedContexts) {
        this.boundedContexts = boundedContexts != null ? new ArrayList<>(boundedContexts) : new ArrayList<>();
    }

    @JsonIgnore
    public String getId() {
        return metadata != null ? metadata.getId() : null;
    }

    public Optional<Element> findElement(String elementId) {
        if (elementId == null) return Optional.empty();
        return elements.stream().filter(e -> elementId.equals(e.getId())).findFirst();
    }

    public Optional<BoundedContext> findContext(String contextId) {
        if (contextId == null) return Optional.empty();
        return boundedContexts.stream().filter(c -> contextId.equals(c.getId())).findFirst();
    }

    public Element requireElement(String elementId) {
        return findElement(elementId)
                .orElseThrow(() -> new NotFoundException(NotFoundException.Kind.ELEMENT, elementId));
    }

    public BoundedContext requireContext(String contextId) {
        return findContext(contextId)
                .orElseThrow(() -> new NotFoundException(NotFoundException.Kind.CONTEXT, contextId));
    }
}
