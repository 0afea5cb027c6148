package com.eventstorming.dispatch.render;

import com.eventstorming.core.config.EventStormingProperties;
import com.eventstorming.core.flow.FlowNode;
import com.eventstorming.core.flow.FlowTrace;
import com.eventstorming.core.model.BoundedContext;
import com.eventstorming.core.model.DetailLevel;
import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.ElementType;
import com.eventstorming.core.model.OperationResult;
import com.eventstorming.core.model.Workshop;
import com.eventstorming.core.model.WorkshopMetadata;
import com.eventstorming.core.model.WorkshopSummary;
import com.eventstorming.core.query.ContextOverview;
import com.eventstorming.core.query.ElementFilter;
import com.eventstorming.core.query.Page;
import com.eventstorming.core.query.PaginationInfo;
import com.eventstorming.core.query.QueryEngine;
import com.eventstorming.core.stats.WorkshopStatistics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Human-readable markdown output. Long responses are cut at the configured
 * character limit with a hint on how to narrow the request.
 */
@Component
public class MarkdownRenderer implements WorkshopRenderer {

    /** Notes longer than this are left out of flow traces. */
    private static final int FLOW_NOTE_LIMIT = 100;

    private static final Comparator<Element> BY_TYPE_THEN_POSITION = Comparator
            .comparing((Element e) -> e.getType().wireName())
            .thenComparingInt(Element::getPosition);

    private final int characterLimit;

    public MarkdownRenderer(EventStormingProperties properties) {
        this.characterLimit = properties.getOutput().getCharacterLimit();
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.MARKDOWN;
    }

    @Override
    public String operationResult(OperationResult result) {
        if (!result.success()) {
            return "**Error**: " + result.error();
        }
        List<String> lines = new ArrayList<>();
        lines.add(result.message());
        if (result.entityId() != null) {
            lines.add("ID: `" + result.entityId() + "`");
        }
        if (result.updatedFields() != null) {
            lines.add("Updated fields: " + String.join(", ", result.updatedFields()));
        }
        if (result.assigned() != null) {
            lines.add("Assigned: " + result.assigned().size());
        }
        if (result.hasWarnings()) {
            lines.add("Elements not found: " + String.join(", ", result.notFound()));
        }
        return String.join("\n", lines);
    }

    @Override
    public String workshopList(List<WorkshopSummary> workshops) {
        List<String> lines = new ArrayList<>();
        lines.add("# Workshops (" + workshops.size() + ")");
        lines.add("");
        if (workshops.isEmpty()) {
            lines.add("No workshops found.");
        }
        for (WorkshopSummary w : workshops) {
            lines.add("- **" + w.name() + "** `" + w.id() + "`"
                    + (w.domain() == null || w.domain().isEmpty() ? "" : " (" + w.domain() + ")")
                    + ": " + w.elementCount() + " elements, " + w.contextCount() + " contexts, updated " + w.updatedAt());
        }
        return String.join("\n", lines);
    }

    @Override
    public String workshop(Workshop workshop, DetailLevel detail) {
        WorkshopMetadata meta = workshop.getMetadata();
        List<String> lines = new ArrayList<>(List.of(
                "# Workshop: " + meta.getName(),
                "**ID**: `" + meta.getId() + "`",
                "**Domain**: " + orDefault(meta.getDomain(), "Not specified"),
                "**Created**: " + meta.getCreatedAt(),
                "**Updated**: " + meta.getUpdatedAt(),
                ""));
        if (!meta.getDescription().isEmpty()) {
            lines.add("**Description**: " + meta.getDescription());
            lines.add("");
        }
        if (!meta.getFacilitators().isEmpty()) {
            lines.add("**Facilitators**: " + String.join(", ", meta.getFacilitators()));
            lines.add("");
        }
        lines.add("## Statistics");
        lines.add("- Total Elements: " + workshop.getElements().size());
        lines.add("- Bounded Contexts: " + workshop.getBoundedContexts().size());
        lines.add("");

        Map<ElementType, Integer> counts = QueryEngine.breakdown(workshop.getElements());
        if (!workshop.getElements().isEmpty()) {
            lines.add("### Elements by Type");
            counts.forEach((type, count) -> {
                if (count > 0) lines.add("- " + type.wireName() + ": " + count);
            });
            lines.add("");
        }
        if (!workshop.getBoundedContexts().isEmpty()) {
            lines.add("## Bounded Contexts");
            for (BoundedContext ctx : workshop.getBoundedContexts()) {
                lines.add("- **" + ctx.getName() + "** (`" + ctx.getId() + "`): " + ctx.getElementIds().size() + " elements");
            }
            lines.add("");
        }
        if (!workshop.getElements().isEmpty()) {
            lines.add(detail == DetailLevel.FULL ? "## Elements" : "## Elements (Summary)");
            workshop.getElements().stream().sorted(BY_TYPE_THEN_POSITION)
                    .forEach(e -> lines.add(elementLine(e, detail)));
        }
        return truncate(String.join("\n", lines), "Use search or timeline to explore elements and contexts");
    }

    @Override
    public String search(String query, Page<Element> page, DetailLevel detail) {
        List<String> lines = new ArrayList<>(List.of(
                "# Search Results: '" + query + "'",
                "Found " + page.pagination().totalItems() + " matching element(s)",
                "",
                pagination(page.pagination()),
                ""));
        if (page.items().isEmpty()) {
            lines.add("No matching elements found on this page.");
        }
        page.items().forEach(e -> lines.add(elementLine(e, detail)));
        return truncate(String.join("\n", lines), "Use a smaller page size or a more specific query");
    }

    @Override
    public String timeline(Page<Element> page, ElementFilter filter, DetailLevel detail) {
        List<String> lines = new ArrayList<>();
        lines.add("# Timeline");
        if (filter.type() != null) {
            lines.add("Filter: " + filter.type().wireName());
        }
        if (filter.boundedContextId() != null) {
            lines.add("Context: " + filter.boundedContextId());
        }
        lines.add("");
        lines.add(pagination(page.pagination()));
        lines.add("");
        if (page.items().isEmpty()) {
            lines.add("No elements found on this page.");
        }
        Integer currentPosition = null;
        for (Element e : page.items()) {
            if (detail == DetailLevel.FULL && (currentPosition == null || currentPosition != e.getPosition())) {
                currentPosition = e.getPosition();
                lines.add("");
                lines.add("## Position " + currentPosition);
            }
            lines.add(elementLine(e, detail));
        }
        return truncate(String.join("\n", lines), "Use a smaller page size or filter by type or context");
    }

    @Override
    public String contexts(List<ContextOverview> overviews, DetailLevel detail) {
        List<String> lines = new ArrayList<>(List.of("# Bounded Contexts", ""));
        if (overviews.isEmpty()) {
            lines.add("No bounded contexts defined.");
        }
        for (ContextOverview o : overviews) {
            BoundedContext ctx = o.context();
            lines.add("## " + ctx.getName());
            lines.add("**ID**: `" + ctx.getId() + "`");
            if (!ctx.getDescription().isEmpty()) lines.add("**Description**: " + ctx.getDescription());
            if (ctx.getColor() != null) lines.add("**Color**: " + ctx.getColor());
            lines.add("**Total Elements**: " + o.totalElements());
            if (o.totalElements() > 0) {
                lines.add("");
                lines.add("### Element Breakdown");
                o.typeBreakdown().forEach((type, count) -> {
                    if (count > 0) lines.add("- " + type.wireName() + ": " + count);
                });
                lines.add("");
                lines.add("### Elements");
                lines.add(pagination(o.elements().pagination()));
                lines.add("");
                o.elements().items().stream().sorted(BY_TYPE_THEN_POSITION)
                        .forEach(e -> lines.add(elementLine(e, detail)));
            }
            lines.add("");
        }
        return truncate(String.join("\n", lines), "Use --context to show a single bounded context");
    }

    @Override
    public String statistics(WorkshopStatistics s) {
        List<String> lines = new ArrayList<>(List.of(
                "# Workshop Statistics: " + s.workshopName(),
                "",
                "## Overview",
                "- **Domain**: " + orDefault(s.domain(), "Not specified"),
                "- **Created**: " + s.createdAt(),
                "- **Last Updated**: " + s.updatedAt(),
                "- **Total Elements**: " + s.totalElements(),
                "- **Bounded Contexts**: " + s.totalContexts(),
                "",
                "## Elements by Type"));
        s.byType().forEach((type, count) -> lines.add("- **" + type.wireName() + "**: " + count));

        if (!s.byContext().isEmpty()) {
            lines.add("");
            lines.add("## Elements by Bounded Context");
            new TreeMap<>(s.byContext()).forEach((name, count) -> lines.add("- **" + name + "**: " + count));
        }

        var rel = s.relationships();
        var cov = s.coverage();
        lines.addAll(List.of(
                "",
                "## Relationships",
                "- Elements with outgoing triggers: " + rel.elementsWithTriggers(),
                "- Elements with incoming triggers: " + rel.elementsWithTriggeredBy(),
                "- Total trigger links: " + rel.totalTriggerLinks(),
                "",
                "## Context Coverage",
                "- Elements assigned to contexts: " + cov.elementsInContexts(),
                "- Elements without context: " + cov.elementsWithoutContext(),
                "- **Coverage**: " + String.format(Locale.ROOT, "%.1f", cov.percentContextualized())
                        + "% of elements are contextualized"));
        return String.join("\n", lines);
    }

    @Override
    public String flow(FlowTrace trace) {
        List<String> lines = new ArrayList<>(List.of("# Event Flow Visualization: " + trace.workshopName(), ""));
        if (!trace.directed()) {
            if (trace.rootCount() == 0) {
                lines.add("No root elements found (all elements are triggered by something).");
                lines.add("This might indicate circular dependencies or incomplete modeling.");
            } else {
                lines.add("Found " + trace.rootCount() + " root element(s)");
                lines.add("");
            }
        }
        for (FlowTrace.Branch branch : trace.branches()) {
            lines.add("## Flow from: " + branch.startName());
            if (trace.directed()) lines.add("");
            branch.nodes().forEach(node -> appendNode(lines, node));
            lines.add("");
        }
        if (!trace.directed() && trace.truncated() && trace.branches().size() < trace.rootCount()) {
            lines.add("... (max elements limit reached)");
        }
        if (trace.truncated()) {
            lines.add("");
            lines.add("Display limit reached (" + trace.maxElements() + " elements). "
                    + "Use --start to focus on a specific flow.");
        }
        return truncate(String.join("\n", lines), "Use --start or a lower --max-depth to focus the flow");
    }

    @Override
    public String error(String message, String suggestion) {
        return "**Error**: " + message + (suggestion != null ? "\n" + suggestion : "");
    }

    private void appendNode(List<String> lines, FlowNode node) {
        String prefix = "  ".repeat(node.depth());
        if (node.limitMarker()) {
            lines.add(prefix + "... (max elements limit reached)");
            return;
        }
        lines.add(prefix + "-> [" + node.type().wireName() + "] **" + node.name() + "** `" + node.elementId() + "`");
        if (node.notes() != null && !node.notes().isEmpty() && node.notes().length() < FLOW_NOTE_LIMIT) {
            lines.add(prefix + "  _" + node.notes() + "_");
        }
        node.children().forEach(child -> appendNode(lines, child));
    }

    private static String elementLine(Element e, DetailLevel detail) {
        if (detail == DetailLevel.SUMMARY) {
            return "- [" + e.getType().wireName() + "] **" + e.getName() + "** (pos: " + e.getPosition()
                    + ", id: `" + e.getId() + "`)";
        }
        List<String> lines = new ArrayList<>();
        lines.add("**[" + e.getType().wireName().toUpperCase(Locale.ROOT) + "]** " + e.getName()
                + " `" + e.getId() + "` (" + e.getType().color() + ")");
        lines.add("  Position: " + e.getPosition());
        if (!e.getNotes().isEmpty()) lines.add("  Notes: " + e.getNotes());
        if (e.hasContext()) lines.add("  Context: " + e.getBoundedContextId());
        if (!e.getTriggeredBy().isEmpty()) lines.add("  Triggered by: " + String.join(", ", e.getTriggeredBy()));
        if (!e.getTriggers().isEmpty()) lines.add("  Triggers: " + String.join(", ", e.getTriggers()));
        return String.join("\n", lines) + "\n";
    }

    private static String pagination(PaginationInfo p) {
        int shown = Math.max(0, Math.min(p.page() * p.pageSize(), p.totalItems()) - (p.page() - 1) * p.pageSize());
        String line = "**Page " + p.page() + " of " + p.totalPages() + "** (showing " + shown
                + " of " + p.totalItems() + " items)";
        List<String> hints = new ArrayList<>();
        if (p.hasNext()) hints.add("Use `--page " + (p.page() + 1) + "` for next page");
        if (p.hasPrev()) hints.add("Use `--page " + (p.page() - 1) + "` for previous page");
        return hints.isEmpty() ? line : line + "\n" + String.join(" | ", hints);
    }

    String truncate(String content, String suggestion) {
        if (content.length() <= characterLimit) {
            return content;
        }
        return content.substring(0, characterLimit)
                + "\n\nResponse truncated (showing ~" + characterLimit + "/" + content.length() + " characters)"
                + "\n" + suggestion;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
