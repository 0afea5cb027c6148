package com.eventstorming.core.query;

import com.eventstorming.core.model.BoundedContext;
import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.ElementType;
import com.eventstorming.core.model.Workshop;
import com.eventstorming.core.model.WorkshopValidationException;
import com.eventstorming.core.store.ContextManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-side listings over a workshop snapshot: text search, timeline and
 * per-context overview. All three share {@link Page#of} for pagination.
 */
@Service
public class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    /** Position first, creation time as tiebreak. */
    static final Comparator<Element> TIMELINE_ORDER = Comparator
            .comparingInt(Element::getPosition)
            .thenComparing(Element::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final ContextManager contextManager;

    public QueryEngine(ContextManager contextManager) {
        this.contextManager = contextManager;
    }

    /**
     * Case-insensitive substring search over element names and notes.
     * Matches keep collection order.
     */
    public Page<Element> search(Workshop workshop, String query, ElementFilter filter, PageRequest request) {
        if (query == null || query.isBlank()) {
            throw new WorkshopValidationException("Search query must not be empty");
        }
        String needle = query.strip().toLowerCase(Locale.ROOT);

        List<Element> matches = workshop.getElements().stream()
                .filter(filter)
                .filter(e -> contains(e.getName(), needle) || contains(e.getNotes(), needle))
                .toList();

        log.debug("Search '{}' matched {} element(s)", needle, matches.size());
        return Page.of(matches, request);
    }

    /**
     * Filtered elements sorted by {@code (position, createdAt)}.
     */
    public Page<Element> timeline(Workshop workshop, ElementFilter filter, PageRequest request) {
        List<Element> ordered = workshop.getElements().stream()
                .filter(filter)
                .sorted(TIMELINE_ORDER)
                .toList();
        return Page.of(ordered, request);
    }

    /**
     * Overview of every context, or of the one with {@code contextId}.
     * The same page request applies to each context's member list.
     *
     * @throws com.eventstorming.core.model.NotFoundException if {@code contextId} is given and unknown
     */
    public List<ContextOverview> contextOverview(Workshop workshop, String contextId, PageRequest request) {
        List<BoundedContext> contexts = contextId != null && !contextId.isBlank()
                ? List.of(workshop.requireContext(contextId))
                : workshop.getBoundedContexts();

        return contexts.stream()
                .map(ctx -> {
                    List<Element> members = contextManager.membersOf(workshop, ctx);
                    return new ContextOverview(ctx, Page.of(members, request), breakdown(members));
                })
                .toList();
    }

    /**
     * Count per element type with every type present.
     */
    public static Map<ElementType, Integer> breakdown(List<Element> elements) {
        Map<ElementType, Integer> counts = new EnumMap<>(ElementType.class);
        for (ElementType type : ElementType.values()) {
            counts.put(type, 0);
        }
        for (Element e : elements) {
            counts.merge(e.getType(), 1, Integer::sum);
        }
        return counts;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
