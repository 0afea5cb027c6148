package com.eventstorming.dispatch.render;

import com.eventstorming.core.flow.FlowTrace;
import com.eventstorming.core.model.DetailLevel;
import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.OperationResult;
import com.eventstorming.core.model.Workshop;
import com.eventstorming.core.model.WorkshopSummary;
import com.eventstorming.core.query.ContextOverview;
import com.eventstorming.core.query.ElementFilter;
import com.eventstorming.core.query.Page;
import com.eventstorming.core.stats.WorkshopStatistics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Machine-readable output using the workshop {@link ObjectMapper}.
 */
@Component
public class JsonRenderer implements WorkshopRenderer {

    private final ObjectMapper objectMapper;
    private final ElementViews views;

    public JsonRenderer(ObjectMapper objectMapper, ElementViews views) {
        this.objectMapper = objectMapper;
        this.views = views;
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public String operationResult(OperationResult result) {
        return write(result);
    }

    @Override
    public String workshopList(List<WorkshopSummary> workshops) {
        return write(Map.of("workshops", workshops, "total", workshops.size()));
    }

    @Override
    public String workshop(Workshop workshop, DetailLevel detail) {
        if (detail == DetailLevel.FULL) {
            return write(workshop);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("metadata", workshop.getMetadata());
        out.put("elements", views.views(workshop.getElements(), DetailLevel.SUMMARY));
        out.put("bounded_contexts", workshop.getBoundedContexts().stream()
                .map(ctx -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("id", ctx.getId());
                    row.put("name", ctx.getName());
                    row.put("element_count", ctx.getElementIds().size());
                    return row;
                })
                .toList());
        out.put("statistics", Map.of(
                "total_elements", workshop.getElements().size(),
                "total_contexts", workshop.getBoundedContexts().size()));
        return write(out);
    }

    @Override
    public String search(String query, Page<Element> page, DetailLevel detail) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("query", query);
        out.put("matches", views.views(page.items(), detail));
        out.put("pagination", page.pagination());
        return write(out);
    }

    @Override
    public String timeline(Page<Element> page, ElementFilter filter, DetailLevel detail) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("timeline", views.views(page.items(), detail));
        out.put("pagination", page.pagination());
        return write(out);
    }

    @Override
    public String contexts(List<ContextOverview> overviews, DetailLevel detail) {
        return write(overviews.stream()
                .map(o -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("context", o.context());
                    row.put("elements", views.views(o.elements().items(), detail));
                    row.put("pagination", o.elements().pagination());
                    row.put("type_breakdown", ElementViews.byWireName(o.typeBreakdown()));
                    return row;
                })
                .toList());
    }

    @Override
    public String statistics(WorkshopStatistics s) {
        Map<String, Object> out = new LinkedHashMap<>();
        Map<String, Object> workshop = new LinkedHashMap<>();
        workshop.put("name", s.workshopName());
        workshop.put("domain", s.domain());
        workshop.put("created_at", s.createdAt());
        workshop.put("updated_at", s.updatedAt());
        out.put("workshop", workshop);
        out.put("totals", Map.of("elements", s.totalElements(), "bounded_contexts", s.totalContexts()));
        out.put("by_type", ElementViews.byWireName(s.byType()));
        out.put("by_context", s.byContext());
        out.put("relationships", s.relationships());
        out.put("coverage", s.coverage());
        return write(out);
    }

    @Override
    public String flow(FlowTrace trace) {
        return write(trace);
    }

    @Override
    public String error(String message, String suggestion) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message);
        if (suggestion != null) {
            out.put("suggestion", suggestion);
        }
        return write(out);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render JSON output", e);
        }
    }
}
