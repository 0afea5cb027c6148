package com.eventstorming.core.flow;

import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.NotFoundException;
import com.eventstorming.core.model.Workshop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Traces cause and effect chains by following {@code triggers} edges.
 * <p>
 * With a start element the trace is one depth-bounded descent from it. Without
 * one, every root (an element with no {@code triggeredBy}) is traced in
 * collection order. Each start owns a fresh visited-set, so a node is shown at
 * most once per start but may reappear under another start; the element
 * budget is shared by the whole call. Termination does not depend on the
 * graph being acyclic.
 */
@Service
public class FlowTracer {

    private static final Logger log = LoggerFactory.getLogger(FlowTracer.class);

    public FlowTrace trace(Workshop workshop, FlowRequest request) {
        Map<String, Element> index = new HashMap<>();
        for (Element e : workshop.getElements()) {
            index.putIfAbsent(e.getId(), e);
        }

        var ctx = new TraversalContext(request.maxDepth(), request.maxElements());
        List<FlowTrace.Branch> branches = new ArrayList<>();
        int rootCount;

        if (request.startElementId() != null) {
            Element start = index.get(request.startElementId());
            if (start == null) {
                throw new NotFoundException(NotFoundException.Kind.START_ELEMENT, request.startElementId());
            }
            rootCount = 1;
            branches.add(new FlowTrace.Branch(start.getId(), start.getName(), descend(ctx, index, start.getId(), 0)));
        } else {
            List<Element> roots = workshop.getElements().stream()
                    .filter(e -> e.getTriggeredBy().isEmpty())
                    .toList();
            rootCount = roots.size();
            for (Element root : roots) {
                if (ctx.exhausted()) {
                    break;
                }
                ctx.beginTraversal();
                branches.add(new FlowTrace.Branch(root.getId(), root.getName(), descend(ctx, index, root.getId(), 0)));
            }
        }

        boolean truncated = ctx.exhausted();
        log.debug("Flow trace visited {} node(s) from {} start(s), truncated={}",
                ctx.visitedCount(), branches.size(), truncated);

        return new FlowTrace(workshop.getMetadata().getName(), request.startElementId(),
                List.copyOf(branches), rootCount, ctx.visitedCount(), ctx.maxElements(), truncated);
    }

    /**
     * @return the node for {@code elementId}, a budget marker, or nothing when the
     *         node is too deep, already visited in this start's tree, or dangling
     */
    private List<FlowNode> descend(TraversalContext ctx, Map<String, Element> index, String elementId, int depth) {
        if (ctx.beyondDepth(depth) || ctx.seen(elementId)) {
            return List.of();
        }
        if (ctx.exhausted()) {
            return List.of(FlowNode.marker(depth));
        }

        // A dangling id still counts against the budget.
        ctx.visit(elementId);
        Element element = index.get(elementId);
        if (element == null) {
            return List.of();
        }

        List<FlowNode> children = new ArrayList<>();
        for (String triggeredId : element.getTriggers()) {
            if (ctx.exhausted()) {
                children.add(FlowNode.marker(depth + 1));
                break;
            }
            children.addAll(descend(ctx, index, triggeredId, depth + 1));
        }
        return List.of(FlowNode.of(element, depth, children));
    }
}
