package com.eventstorming.dispatch.render;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the {@link WorkshopRenderer} for an {@link OutputFormat}.
 */
@Component
public class RendererRegistry {

    private final Map<OutputFormat, WorkshopRenderer> renderers = new EnumMap<>(OutputFormat.class);

    public RendererRegistry(List<WorkshopRenderer> renderers) {
        for (WorkshopRenderer renderer : renderers) {
            this.renderers.put(renderer.format(), renderer);
        }
    }

    public WorkshopRenderer forFormat(OutputFormat format) {
        WorkshopRenderer renderer = renderers.get(format != null ? format : OutputFormat.MARKDOWN);
        if (renderer == null) {
            throw new IllegalStateException("No renderer registered for " + format);
        }
        return renderer;
    }
}
