package com.eventstorming.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workshop operations.
 */
@Service
public class WorkshopMetrics {

    private final MeterRegistry registry;

    public WorkshopMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordMutation(String operation, boolean success) {
        Counter.builder("eventstorming.mutations.total")
                .tag("operation", operation)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordQuery(String query, long ms) {
        Timer.builder("eventstorming.query.duration")
                .tag("query", query)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records the size of a flow trace and whether it hit the element budget.
     */
    public void recordFlowTrace(int visited, boolean truncated) {
        DistributionSummary.builder("eventstorming.flow.visited")
                .register(registry)
                .record(visited);
        if (truncated) {
            Counter.builder("eventstorming.flow.truncated")
                    .description("Flow traces that exhausted the element budget")
                    .register(registry)
                    .increment();
        }
    }

    public void incrementNotFound(String kind) {
        Counter.builder("eventstorming.not_found.total")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
