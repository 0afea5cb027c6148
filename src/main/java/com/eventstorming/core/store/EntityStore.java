package com.eventstorming.core.store;

import com.eventstorming.core.model.BoundedContext;
import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.ElementDraft;
import com.eventstorming.core.model.ElementPatch;
import com.eventstorming.core.model.Timestamps;
import com.eventstorming.core.model.Workshop;
import com.eventstorming.core.model.WorkshopMetadata;
import com.eventstorming.core.model.WorkshopValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Create, update and delete operations over the elements and bounded contexts
 * of one loaded workshop snapshot.
 * <p>
 * Every operation validates before it touches the snapshot, so a failed call
 * leaves the workshop unchanged. Deletion is the only place where dangling
 * references are repaired; trigger lists are otherwise stored as given and
 * never reconciled against the peer element.
 */
@Service
public class EntityStore {

    private static final Logger log = LoggerFactory.getLogger(EntityStore.class);

    private final Clock clock;

    public EntityStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates an empty workshop with fresh id and timestamps.
     */
    public Workshop createWorkshop(String name, String description, String domain, List<String> facilitators) {
        if (name == null || name.isBlank()) {
            throw new WorkshopValidationException("Workshop name is required");
        }
        String timestamp = Timestamps.now(clock);
        var metadata = new WorkshopMetadata();
        metadata.setId(Timestamps.newId());
        metadata.setName(name.strip());
        metadata.setDescription(description);
        metadata.setDomain(domain);
        metadata.setFacilitators(facilitators);
        metadata.setCreatedAt(timestamp);
        metadata.setUpdatedAt(timestamp);

        var workshop = new Workshop();
        workshop.setMetadata(metadata);
        return workshop;
    }

    /**
     * Appends a new element to the workshop.
     * <p>
     * Without an explicit position the element goes to the end of its own type
     * lane: the position is the number of elements already of that type.
     */
    public Element createElement(Workshop workshop, ElementDraft draft) {
        int position = draft.position() != null
                ? draft.position()
                : (int) workshop.getElements().stream().filter(e -> e.getType() == draft.type()).count();

        String timestamp = Timestamps.now(clock);
        var element = new Element();
        element.setId(Timestamps.newId());
        element.setType(draft.type());
        element.setName(draft.name());
        element.setPosition(position);
        element.setNotes(draft.notes());
        element.setCreatedBy(draft.createdBy());
        element.setCreatedAt(timestamp);
        element.setUpdatedAt(timestamp);
        element.setTriggers(draft.triggers());
        element.setTriggeredBy(draft.triggeredBy());
        element.setBoundedContextId(blankToNull(draft.boundedContextId()));

        workshop.getElements().add(element);

        if (element.hasContext()) {
            workshop.findContext(element.getBoundedContextId()).ifPresentOrElse(
                    ctx -> ctx.addMember(element.getId()),
                    () -> log.debug("Element {} references unknown context {}",
                            element.getId(), element.getBoundedContextId()));
        }

        log.info("Added {} '{}' at position {}", draft.type().wireName(), element.getName(), position);
        return element;
    }

    /**
     * Applies the supplied fields of a patch to an element.
     *
     * @return names of the fields that were written, in a fixed order
     */
    public List<String> updateElement(Workshop workshop, String elementId, ElementPatch patch) {
        Element element = workshop.requireElement(elementId);
        List<String> updated = new ArrayList<>();

        if (patch.name() != null) {
            element.setName(patch.name().strip());
            updated.add("name");
        }
        if (patch.position() != null) {
            element.setPosition(patch.position());
            updated.add("position");
        }
        if (patch.notes() != null) {
            element.setNotes(patch.notes());
            updated.add("notes");
        }
        if (patch.triggers() != null) {
            element.setTriggers(patch.triggers());
            updated.add("triggers");
        }
        if (patch.triggeredBy() != null) {
            element.setTriggeredBy(patch.triggeredBy());
            updated.add("triggered_by");
        }
        if (patch.boundedContextId() != null) {
            String newContextId = ElementPatch.CLEAR_CONTEXT.equals(patch.boundedContextId())
                    ? null
                    : blankToNull(patch.boundedContextId());
            moveToContext(workshop, element, newContextId);
            updated.add("bounded_context_id");
        }

        element.setUpdatedAt(Timestamps.now(clock));
        log.info("Updated element {} fields {}", elementId, updated);
        return updated;
    }

    /**
     * Removes an element and strips its id from every trigger list and every
     * context membership list.
     *
     * @return the removed element
     */
    public Element deleteElement(Workshop workshop, String elementId) {
        Element element = workshop.requireElement(elementId);

        workshop.getElements().removeIf(e -> elementId.equals(e.getId()));
        for (Element other : workshop.getElements()) {
            other.getTriggers().removeIf(elementId::equals);
            other.getTriggeredBy().removeIf(elementId::equals);
        }
        for (BoundedContext ctx : workshop.getBoundedContexts()) {
            ctx.removeMember(elementId);
        }

        log.info("Deleted {} '{}' ({})", element.getType().wireName(), element.getName(), elementId);
        return element;
    }

    /**
     * Adds a new, empty bounded context.
     */
    public BoundedContext createBoundedContext(Workshop workshop, String name, String description, String color) {
        if (name == null || name.isBlank()) {
            throw new WorkshopValidationException("Context name is required");
        }
        var context = new BoundedContext();
        context.setId(Timestamps.newId());
        context.setName(name.strip());
        context.setDescription(description);
        context.setColor(blankToNull(color));
        workshop.getBoundedContexts().add(context);

        log.info("Created bounded context '{}' ({})", context.getName(), context.getId());
        return context;
    }

    /**
     * Points an element at a new context (or none) and moves its id between the
     * membership lists of the old and new contexts.
     */
    static void moveToContext(Workshop workshop, Element element, String newContextId) {
        String oldContextId = element.getBoundedContextId();
        element.setBoundedContextId(newContextId);

        if (oldContextId != null && !Objects.equals(oldContextId, newContextId)) {
            workshop.findContext(oldContextId).ifPresent(ctx -> ctx.removeMember(element.getId()));
        }
        if (newContextId != null) {
            workshop.findContext(newContextId).ifPresent(ctx -> ctx.addMember(element.getId()));
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
