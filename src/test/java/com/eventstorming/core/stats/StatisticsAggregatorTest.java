package com.eventstorming.core.stats;

import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.ElementType;
import com.eventstorming.core.model.Workshop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.eventstorming.core.WorkshopFixtures.context;
import static com.eventstorming.core.WorkshopFixtures.element;
import static com.eventstorming.core.WorkshopFixtures.event;
import static com.eventstorming.core.WorkshopFixtures.link;
import static com.eventstorming.core.WorkshopFixtures.workshop;
import static org.junit.jupiter.api.Assertions.*;

class StatisticsAggregatorTest {

    private StatisticsAggregator aggregator;
    private Workshop workshop;

    @BeforeEach
    void setUp() {
        aggregator = new StatisticsAggregator();
        workshop = workshop("w-1", "Checkout");
    }

    @Test
    @DisplayName("empty workshop reports every type with zero and 0% coverage")
    void emptyWorkshop() {
        WorkshopStatistics stats = aggregator.compute(workshop);

        assertEquals(0, stats.totalElements());
        assertEquals(ElementType.values().length, stats.byType().size());
        assertTrue(stats.byType().values().stream().allMatch(count -> count == 0));
        assertTrue(stats.byContext().isEmpty());
        assertEquals(0.0, stats.coverage().percentContextualized());
        assertEquals("Checkout", stats.workshopName());
        assertEquals("Ordering", stats.domain());
    }

    @Test
    @DisplayName("counts relationships and context coverage")
    void relationshipsAndCoverage() {
        Element cmd = element(workshop, "c1", ElementType.COMMAND, "Place Order", 0);
        Element evt = event(workshop, "e1", "Order Placed");
        Element policy = element(workshop, "p1", ElementType.POLICY, "Reserve Stock", 2);
        event(workshop, "e2", "Stock Reserved");
        link(cmd, evt);
        link(evt, policy);
        link(cmd, policy);
        context(workshop, "c-sales", "Sales", cmd, evt);

        WorkshopStatistics stats = aggregator.compute(workshop);

        assertEquals(4, stats.totalElements());
        assertEquals(1, stats.totalContexts());
        assertEquals(2, stats.byType().get(ElementType.EVENT));
        assertEquals(2, stats.relationships().elementsWithTriggers());
        assertEquals(2, stats.relationships().elementsWithTriggeredBy());
        assertEquals(3, stats.relationships().totalTriggerLinks());
        assertEquals(2, stats.coverage().elementsInContexts());
        assertEquals(2, stats.coverage().elementsWithoutContext());
        assertEquals(50.0, stats.coverage().percentContextualized());
        assertEquals(Map.of("Sales", 1), stats.byContext());
    }

    @Test
    @DisplayName("contexts sharing a name keep one entry holding the later context's count")
    void sameNameContextsMerge() {
        Element a = event(workshop, "e1", "Order Placed");
        Element b = event(workshop, "e2", "Order Shipped");
        Element c = event(workshop, "e3", "Invoice Sent");
        context(workshop, "c-1", "Sales", a, b);
        context(workshop, "c-2", "Sales", c);

        WorkshopStatistics stats = aggregator.compute(workshop);

        assertEquals(2, stats.totalContexts());
        assertEquals(Map.of("Sales", 1), stats.byContext());
    }
}
