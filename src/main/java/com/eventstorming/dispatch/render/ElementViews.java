package com.eventstorming.dispatch.render;

import com.eventstorming.core.model.DetailLevel;
import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.ElementType;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Map views of elements for JSON output at a given {@link DetailLevel}.
 */
@Component
public class ElementViews {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ElementViews(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> view(Element element, DetailLevel detail) {
        if (detail == DetailLevel.FULL) {
            return objectMapper.convertValue(element, MAP_TYPE);
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", element.getId());
        summary.put("type", element.getType().wireName());
        summary.put("name", element.getName());
        summary.put("position", element.getPosition());
        summary.put("bounded_context_id", element.getBoundedContextId());
        return summary;
    }

    public List<Map<String, Object>> views(List<Element> elements, DetailLevel detail) {
        return elements.stream().map(e -> view(e, detail)).toList();
    }

    /**
     * Re-keys a per-type count map by wire name, keeping enum order.
     */
    public static Map<String, Integer> byWireName(Map<ElementType, Integer> counts) {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (ElementType type : ElementType.values()) {
            result.put(type.wireName(), counts.getOrDefault(type, 0));
        }
        return result;
    }
}
