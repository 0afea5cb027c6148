package com.eventstorming.core.store;

import com.eventstorming.core.model.BoundedContext;
import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.Workshop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maintains the two-way link between elements and bounded contexts.
 */
@Service
public class ContextManager {

    private static final Logger log = LoggerFactory.getLogger(ContextManager.class);

    /**
     * Outcome of a batch assignment. Missing ids are reported, not failed.
     *
     * @param context  the target context
     * @param assigned ids that now belong to the context, in request order
     * @param notFound ids with no matching element
     */
    public record Assignment(BoundedContext context, List<String> assigned, List<String> notFound) {}

    /**
     * Assigns existing elements to a context. Only a missing context fails the
     * call; unknown element ids are collected into {@link Assignment#notFound()}.
     * An element already in another context is taken out of that context's
     * member list.
     *
     * @throws com.eventstorming.core.model.NotFoundException if the context does not exist
     */
    public Assignment assignToContext(Workshop workshop, String contextId, List<String> elementIds) {
        BoundedContext context = workshop.requireContext(contextId);

        List<String> assigned = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        for (String elementId : elementIds) {
            Optional<Element> element = workshop.findElement(elementId);
            if (element.isPresent()) {
                EntityStore.moveToContext(workshop, element.get(), contextId);
                assigned.add(elementId);
            } else {
                notFound.add(elementId);
            }
        }

        if (!notFound.isEmpty()) {
            log.warn("Context '{}': {} element id(s) not found: {}", context.getName(), notFound.size(), notFound);
        }
        log.info("Assigned {} element(s) to context '{}'", assigned.size(), context.getName());
        return new Assignment(context, assigned, notFound);
    }

    /**
     * Members of a context, looked up through its {@code elementIds} and
     * returned in element collection order. Stale ids are ignored.
     */
    public List<Element> membersOf(Workshop workshop, BoundedContext context) {
        return workshop.getElements().stream()
                .filter(e -> context.getElementIds().contains(e.getId()))
                .toList();
    }
}
