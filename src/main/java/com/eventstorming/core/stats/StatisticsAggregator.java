package com.eventstorming.core.stats;

import com.eventstorming.core.model.BoundedContext;
import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.Workshop;
import com.eventstorming.core.query.QueryEngine;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives {@link WorkshopStatistics} from a snapshot. Pure; the workshop is not modified.
 */
@Service
public class StatisticsAggregator {

    public WorkshopStatistics compute(Workshop workshop) {
        var metadata = workshop.getMetadata();

        // Keyed by name: of two contexts with the same name, the later one's count is kept.
        Map<String, Integer> byContext = new LinkedHashMap<>();
        for (BoundedContext ctx : workshop.getBoundedContexts()) {
            byContext.put(ctx.getName(), ctx.getElementIds().size());
        }

        int withTriggers = 0;
        int withTriggeredBy = 0;
        int links = 0;
        int inContexts = 0;
        for (Element e : workshop.getElements()) {
            if (!e.getTriggers().isEmpty()) {
                withTriggers++;
                links += e.getTriggers().size();
            }
            if (!e.getTriggeredBy().isEmpty()) {
                withTriggeredBy++;
            }
            if (e.hasContext()) {
                inContexts++;
            }
        }

        int total = workshop.getElements().size();
        int withoutContext = total - inContexts;
        double percent = total == 0 ? 0.0 : (inContexts * 100.0) / total;

        return new WorkshopStatistics(
                metadata.getName(),
                metadata.getDomain(),
                metadata.getCreatedAt(),
                metadata.getUpdatedAt(),
                total,
                workshop.getBoundedContexts().size(),
                QueryEngine.breakdown(workshop.getElements()),
                byContext,
                new WorkshopStatistics.Relationships(withTriggers, withTriggeredBy, links),
                new WorkshopStatistics.Coverage(inContexts, withoutContext, percent)
        );
    }
}
