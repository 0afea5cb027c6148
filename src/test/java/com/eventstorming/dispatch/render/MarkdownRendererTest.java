package com.eventstorming.dispatch.render;

import com.eventstorming.core.config.EventStormingProperties;
import com.eventstorming.core.flow.FlowRequest;
import com.eventstorming.core.flow.FlowTracer;
import com.eventstorming.core.model.DetailLevel;
import com.eventstorming.core.model.ElementType;
import com.eventstorming.core.model.OperationResult;
import com.eventstorming.core.model.Workshop;
import com.eventstorming.core.query.ElementFilter;
import com.eventstorming.core.query.PageRequest;
import com.eventstorming.core.query.QueryEngine;
import com.eventstorming.core.stats.StatisticsAggregator;
import com.eventstorming.core.store.ContextManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.eventstorming.core.WorkshopFixtures.context;
import static com.eventstorming.core.WorkshopFixtures.element;
import static com.eventstorming.core.WorkshopFixtures.event;
import static com.eventstorming.core.WorkshopFixtures.link;
import static com.eventstorming.core.WorkshopFixtures.workshop;
import static org.junit.jupiter.api.Assertions.*;

class MarkdownRendererTest {

    private MarkdownRenderer renderer;
    private Workshop workshop;

    private static MarkdownRenderer withLimit(int limit) {
        var properties = new EventStormingProperties();
        properties.getOutput().setCharacterLimit(limit);
        return new MarkdownRenderer(properties);
    }

    @BeforeEach
    void setUp() {
        renderer = withLimit(25000);
        workshop = workshop("w-1", "Checkout");
        var cmd = element(workshop, "c1", ElementType.COMMAND, "Place Order", 0);
        var evt = element(workshop, "e1", ElementType.EVENT, "Order Placed", 1);
        evt.setNotes("Emitted once payment is authorized");
        link(cmd, evt);
        context(workshop, "ctx-1", "Sales", cmd, evt);
    }

    @Test
    @DisplayName("workshop view lists contexts and elements")
    void workshopView() {
        String out = renderer.workshop(workshop, DetailLevel.SUMMARY);

        assertTrue(out.startsWith("# Workshop: Checkout"));
        assertTrue(out.contains("**Domain**: Ordering"));
        assertTrue(out.contains("- **Sales** (`ctx-1`): 2 elements"));
        assertTrue(out.contains("- [event] **Order Placed** (pos: 1, id: `e1`)"));
    }

    @Test
    @DisplayName("full detail shows notes and triggers")
    void fullDetail() {
        String out = renderer.workshop(workshop, DetailLevel.FULL);

        assertTrue(out.contains("**[EVENT]** Order Placed `e1` (orange)"));
        assertTrue(out.contains("Notes: Emitted once payment is authorized"));
        assertTrue(out.contains("Triggered by: c1"));
    }

    @Test
    @DisplayName("timeline in full detail groups by position")
    void timelineGroups() {
        var page = new QueryEngine(new ContextManager())
                .timeline(workshop, ElementFilter.none(), PageRequest.firstPage());

        String out = renderer.timeline(page, new ElementFilter(ElementType.EVENT, null), DetailLevel.FULL);

        assertTrue(out.contains("Filter: event"));
        assertTrue(out.contains("## Position 0"));
        assertTrue(out.contains("## Position 1"));
    }

    @Test
    @DisplayName("pagination hints point at neighbouring pages")
    void paginationHints() {
        var page = new QueryEngine(new ContextManager())
                .search(workshop, "order", ElementFilter.none(), new PageRequest(1, 1));

        String out = renderer.search("order", page, DetailLevel.SUMMARY);

        assertTrue(out.contains("**Page 1 of 2** (showing 1 of 2 items)"));
        assertTrue(out.contains("Use `--page 2` for next page"));
    }

    @Test
    @DisplayName("statistics show coverage with one decimal")
    void statistics() {
        event(workshop, "e2", "Stock Reserved");
        String out = renderer.statistics(new StatisticsAggregator().compute(workshop));

        assertTrue(out.contains("- **event**: 2"));
        assertTrue(out.contains("- **Sales**: 2"));
        assertTrue(out.contains("- Total trigger links: 1"));
        assertTrue(out.contains("66.7% of elements are contextualized"));
    }

    @Nested
    @DisplayName("Flow")
    class FlowTests {

        @Test
        @DisplayName("renders nested arrows with ids")
        void tree() {
            String out = renderer.flow(new FlowTracer().trace(workshop, FlowRequest.allRoots()));

            assertTrue(out.contains("Found 1 root element(s)"));
            assertTrue(out.contains("## Flow from: Place Order"));
            assertTrue(out.contains("-> [command] **Place Order** `c1`"));
            assertTrue(out.contains("  -> [event] **Order Placed** `e1`"));
            assertTrue(out.contains("_Emitted once payment is authorized_"));
        }

        @Test
        @DisplayName("budget markers and the limit notice are shown")
        void truncated() {
            String out = renderer.flow(new FlowTracer().trace(workshop, new FlowRequest("c1", 5, 1)));

            assertTrue(out.contains("... (max elements limit reached)"));
            assertTrue(out.contains("Display limit reached (1 elements)"));
        }

        @Test
        @DisplayName("cyclic graphs without roots are explained")
        void noRoots() {
            Workshop cyclic = workshop("w-2", "Cycle");
            var a = event(cyclic, "a", "A");
            var b = event(cyclic, "b", "B");
            link(a, b);
            link(b, a);

            String out = renderer.flow(new FlowTracer().trace(cyclic, FlowRequest.allRoots()));

            assertTrue(out.contains("No root elements found"));
        }
    }

    @Test
    @DisplayName("long output is truncated with a suggestion")
    void truncation() {
        String out = withLimit(40).workshop(workshop, DetailLevel.FULL);

        assertTrue(out.startsWith("# Workshop: Checkout"));
        assertTrue(out.contains("Response truncated (showing ~40/"));
        assertTrue(out.contains("Use search or timeline"));
    }

    @Test
    @DisplayName("operation results include warnings for unknown ids")
    void operationResult() {
        String out = renderer.operationResult(OperationResult.assigned("ctx-1", "Assigned 1 element(s) to 'Sales'",
                List.of("e1"), List.of("ghost")));

        assertTrue(out.startsWith("Assigned 1 element(s) to 'Sales'"));
        assertTrue(out.contains("Elements not found: ghost"));
        assertEquals("**Error**: boom", renderer.operationResult(OperationResult.failure("boom")));
    }
}
