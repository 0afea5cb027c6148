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

import java.util.List;

/**
 * Turns operation and query results into text for one {@link OutputFormat}.
 */
public interface WorkshopRenderer {

    OutputFormat format();

    String operationResult(OperationResult result);

    String workshopList(List<WorkshopSummary> workshops);

    String workshop(Workshop workshop, DetailLevel detail);

    String search(String query, Page<Element> page, DetailLevel detail);

    String timeline(Page<Element> page, ElementFilter filter, DetailLevel detail);

    String contexts(List<ContextOverview> overviews, DetailLevel detail);

    String statistics(WorkshopStatistics statistics);

    String flow(FlowTrace trace);

    String error(String message, String suggestion);
}
