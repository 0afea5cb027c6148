package com.eventstorming.core.service;

import com.eventstorming.core.flow.FlowRequest;
import com.eventstorming.core.flow.FlowTrace;
import com.eventstorming.core.flow.FlowTracer;
import com.eventstorming.core.logging.MdcContext;
import com.eventstorming.core.metrics.WorkshopMetrics;
import com.eventstorming.core.model.BoundedContext;
import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.ElementDraft;
import com.eventstorming.core.model.ElementPatch;
import com.eventstorming.core.model.NotFoundException;
import com.eventstorming.core.model.OperationResult;
import com.eventstorming.core.model.Workshop;
import com.eventstorming.core.model.WorkshopSummary;
import com.eventstorming.core.model.WorkshopValidationException;
import com.eventstorming.core.persistence.WorkshopRepository;
import com.eventstorming.core.persistence.WorkshopTransfer;
import com.eventstorming.core.query.ContextOverview;
import com.eventstorming.core.query.ElementFilter;
import com.eventstorming.core.query.Page;
import com.eventstorming.core.query.PageRequest;
import com.eventstorming.core.query.QueryEngine;
import com.eventstorming.core.stats.StatisticsAggregator;
import com.eventstorming.core.stats.WorkshopStatistics;
import com.eventstorming.core.store.ContextManager;
import com.eventstorming.core.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Function;

/**
 * One request, one unit of work: load a fresh snapshot, run a single operation
 * in memory and, for mutations, save the snapshot exactly once.
 * <p>
 * Mutations never throw for missing ids or bad input; they return
 * {@link OperationResult#failure(String)} and nothing is saved. Queries let
 * {@link NotFoundException} and {@link WorkshopValidationException} propagate
 * to the caller, which renders them as structured errors.
 */
@Service
public class WorkshopService {

    private static final Logger log = LoggerFactory.getLogger(WorkshopService.class);

    private final WorkshopRepository repository;
    private final EntityStore entityStore;
    private final ContextManager contextManager;
    private final QueryEngine queryEngine;
    private final StatisticsAggregator statisticsAggregator;
    private final FlowTracer flowTracer;
    private final WorkshopTransfer transfer;
    private final WorkshopMetrics metrics;

    public WorkshopService(WorkshopRepository repository,
                           EntityStore entityStore,
                           ContextManager contextManager,
                           QueryEngine queryEngine,
                           StatisticsAggregator statisticsAggregator,
                           FlowTracer flowTracer,
                           WorkshopTransfer transfer,
                           WorkshopMetrics metrics) {
        this.repository = repository;
        this.entityStore = entityStore;
        this.contextManager = contextManager;
        this.queryEngine = queryEngine;
        this.statisticsAggregator = statisticsAggregator;
        this.flowTracer = flowTracer;
        this.transfer = transfer;
        this.metrics = metrics;
    }

    // -- Workshops ------------------------------------------------------------

    public OperationResult createWorkshop(String name, String description, String domain, List<String> facilitators) {
        try {
            Workshop workshop = entityStore.createWorkshop(name, description, domain, facilitators);
            repository.save(workshop);
            metrics.recordMutation("create_workshop", true);
            log.info("Created workshop '{}' ({})", workshop.getMetadata().getName(), workshop.getId());
            return OperationResult.created(workshop.getId(),
                    "Workshop '" + workshop.getMetadata().getName() + "' created successfully");
        } catch (WorkshopValidationException e) {
            metrics.recordMutation("create_workshop", false);
            return OperationResult.failure(e.getMessage());
        }
    }

    public List<WorkshopSummary> listWorkshops() {
        return repository.list();
    }

    public Workshop loadWorkshop(String workshopId) {
        return query("load", workshopId, Function.identity());
    }

    // -- Elements -------------------------------------------------------------

    public OperationResult addElement(String workshopId, ElementDraft draft) {
        return mutate("add_element", workshopId, workshop -> {
            Element element = entityStore.createElement(workshop, draft);
            return OperationResult.created(element.getId(),
                    capitalize(element.getType().wireName()) + " '" + element.getName() + "' added successfully at position "
                            + element.getPosition());
        });
    }

    public OperationResult updateElement(String workshopId, String elementId, ElementPatch patch) {
        return mutate("update_element", workshopId,
                workshop -> OperationResult.updated(elementId, entityStore.updateElement(workshop, elementId, patch)));
    }

    public OperationResult deleteElement(String workshopId, String elementId) {
        return mutate("delete_element", workshopId, workshop -> {
            Element removed = entityStore.deleteElement(workshop, elementId);
            return OperationResult.created(removed.getId(),
                    capitalize(removed.getType().wireName()) + " '" + removed.getName() + "' deleted successfully");
        });
    }

    // -- Bounded contexts -----------------------------------------------------

    public OperationResult createBoundedContext(String workshopId, String name, String description, String color) {
        return mutate("create_context", workshopId, workshop -> {
            BoundedContext context = entityStore.createBoundedContext(workshop, name, description, color);
            return OperationResult.created(context.getId(),
                    "Bounded context '" + context.getName() + "' created successfully");
        });
    }

    public OperationResult assignToContext(String workshopId, String contextId, List<String> elementIds) {
        if (elementIds == null || elementIds.isEmpty()) {
            return OperationResult.failure("At least one element id is required");
        }
        return mutate("assign_to_context", workshopId, workshop -> {
            var assignment = contextManager.assignToContext(workshop, contextId, elementIds);
            String message = "Assigned " + assignment.assigned().size() + " element(s) to '"
                    + assignment.context().getName() + "'";
            if (!assignment.notFound().isEmpty()) {
                message += "; elements not found: " + String.join(", ", assignment.notFound());
            }
            return OperationResult.assigned(contextId, message, assignment.assigned(), assignment.notFound());
        });
    }

    // -- Queries --------------------------------------------------------------

    public Page<Element> search(String workshopId, String query, ElementFilter filter, PageRequest page) {
        return query("search", workshopId, workshop -> queryEngine.search(workshop, query, filter, page));
    }

    public Page<Element> timeline(String workshopId, ElementFilter filter, PageRequest page) {
        return query("timeline", workshopId, workshop -> queryEngine.timeline(workshop, filter, page));
    }

    public List<ContextOverview> contextOverview(String workshopId, String contextId, PageRequest page) {
        return query("context_overview", workshopId, workshop -> queryEngine.contextOverview(workshop, contextId, page));
    }

    public WorkshopStatistics statistics(String workshopId) {
        return query("statistics", workshopId, statisticsAggregator::compute);
    }

    public FlowTrace traceFlow(String workshopId, FlowRequest request) {
        FlowTrace trace = query("flow", workshopId, workshop -> flowTracer.trace(workshop, request));
        metrics.recordFlowTrace(trace.visitedCount(), trace.truncated());
        return trace;
    }

    // -- Export / import ------------------------------------------------------

    public String exportWorkshop(String workshopId, boolean includeMetadata) {
        return query("export", workshopId, workshop -> transfer.export(workshop, includeMetadata));
    }

    /**
     * Imports an exported payload as a new workshop. The payload is fully parsed
     * and validated before anything is saved.
     */
    public OperationResult importWorkshop(String payload, String newName) {
        try {
            Workshop workshop = transfer.importWorkshop(payload, newName);
            repository.save(workshop);
            metrics.recordMutation("import_workshop", true);
            return OperationResult.created(workshop.getId(),
                    "Workshop '" + workshop.getMetadata().getName() + "' imported successfully ("
                            + workshop.getElements().size() + " elements, "
                            + workshop.getBoundedContexts().size() + " bounded contexts)");
        } catch (WorkshopValidationException e) {
            metrics.recordMutation("import_workshop", false);
            log.info("Rejected workshop import: {}", e.getMessage());
            return OperationResult.failure(e.getMessage());
        }
    }

    // -- Unit of work ---------------------------------------------------------

    private OperationResult mutate(String operation, String workshopId, Function<Workshop, OperationResult> action) {
        MdcContext.setOperation(workshopId, operation);
        try {
            Workshop workshop = repository.load(workshopId);
            OperationResult result = action.apply(workshop);
            repository.save(workshop);
            metrics.recordMutation(operation, true);
            return result;
        } catch (NotFoundException e) {
            metrics.recordMutation(operation, false);
            metrics.incrementNotFound(e.getKind().name().toLowerCase());
            log.info("{} failed: {}", operation, e.getMessage());
            return OperationResult.failure(e.getMessage());
        } catch (WorkshopValidationException e) {
            metrics.recordMutation(operation, false);
            log.info("{} rejected: {}", operation, e.getMessage());
            return OperationResult.failure(e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private <T> T query(String name, String workshopId, Function<Workshop, T> action) {
        MdcContext.setOperation(workshopId, name);
        long start = System.currentTimeMillis();
        try {
            return action.apply(repository.load(workshopId));
        } catch (NotFoundException e) {
            metrics.incrementNotFound(e.getKind().name().toLowerCase());
            throw e;
        } finally {
            metrics.recordQuery(name, System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }

    /** "read_model" becomes "Read_Model". */
    private static String capitalize(String wireName) {
        StringBuilder out = new StringBuilder(wireName.length());
        boolean upper = true;
        for (char c : wireName.toCharArray()) {
            out.append(upper ? Character.toUpperCase(c) : c);
            upper = c == '_';
        }
        return out.toString();
    }
}
