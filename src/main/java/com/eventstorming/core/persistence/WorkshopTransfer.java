package com.eventstorming.core.persistence;

import com.eventstorming.core.model.BoundedContext;
import com.eventstorming.core.model.Element;
import com.eventstorming.core.model.Timestamps;
import com.eventstorming.core.model.Workshop;
import com.eventstorming.core.model.WorkshopValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashSet;
import java.util.Set;

/**
 * Export of a full snapshot to JSON and import of such a payload as a new workshop.
 * <p>
 * Import keeps every element and context id but gives the workshop a fresh id
 * and fresh timestamps. A payload that cannot be parsed or does not match the
 * entity shapes is rejected with {@link WorkshopValidationException}; nothing
 * is returned for the caller to save in that case.
 */
@Service
public class WorkshopTransfer {

    private static final Logger log = LoggerFactory.getLogger(WorkshopTransfer.class);

    static final String EXPORT_VERSION = "1.0";
    static final String TOOL_NAME = "eventstorming";

    private final ObjectMapper objectMapper;
    private final SchemaMigrator migrator;
    private final Clock clock;

    public WorkshopTransfer(ObjectMapper objectMapper, SchemaMigrator migrator, Clock clock) {
        this.objectMapper = objectMapper;
        this.migrator = migrator;
        this.clock = clock;
    }

    /**
     * Serializes the workshop with an {@code export_info} block. Without metadata
     * only the name, domain and description of the workshop are kept.
     */
    public String export(Workshop workshop, boolean includeMetadata) {
        ObjectNode root = objectMapper.valueToTree(workshop);
        if (!includeMetadata) {
            ObjectNode reduced = objectMapper.createObjectNode();
            reduced.put("name", workshop.getMetadata().getName());
            reduced.put("domain", workshop.getMetadata().getDomain());
            reduced.put("description", workshop.getMetadata().getDescription());
            root.set("metadata", reduced);
        }
        ObjectNode exportInfo = root.putObject("export_info");
        exportInfo.put("exported_at", Timestamps.now(clock));
        exportInfo.put("version", EXPORT_VERSION);
        exportInfo.put("tool", TOOL_NAME);

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new WorkshopStorageException("Failed to export workshop " + workshop.getId(), e);
        }
    }

    /**
     * Parses an exported payload into a new, validated workshop.
     *
     * @param payload JSON produced by {@link #export}
     * @param newName optional replacement name
     */
    public Workshop importWorkshop(String payload, String newName) {
        if (payload == null || payload.isBlank()) {
            throw new WorkshopValidationException("Workshop data is required");
        }

        JsonNode tree;
        try {
            tree = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new WorkshopValidationException("Invalid JSON data: " + e.getOriginalMessage(), e);
        }
        if (!(tree instanceof ObjectNode root) || !(root.get("metadata") instanceof ObjectNode metadata)) {
            throw new WorkshopValidationException("Failed to import workshop: a metadata object is required");
        }

        migrator.migrate(root);
        root.remove("export_info");

        String timestamp = Timestamps.now(clock);
        metadata.put("id", Timestamps.newId());
        metadata.put("created_at", timestamp);
        metadata.put("updated_at", timestamp);
        if (newName != null && !newName.isBlank()) {
            metadata.put("name", newName.strip());
        }

        Workshop workshop;
        try {
            workshop = objectMapper.treeToValue(root, Workshop.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new WorkshopValidationException("Failed to import workshop: " + e.getMessage(), e);
        }
        validate(workshop);

        log.info("Imported workshop '{}' as {} ({} elements, {} contexts)", workshop.getMetadata().getName(),
                workshop.getId(), workshop.getElements().size(), workshop.getBoundedContexts().size());
        return workshop;
    }

    private static void validate(Workshop workshop) {
        if (isBlank(workshop.getMetadata().getName())) {
            throw new WorkshopValidationException("Failed to import workshop: metadata.name is required");
        }
        Set<String> elementIds = new HashSet<>();
        for (Element e : workshop.getElements()) {
            if (e == null || isBlank(e.getId()) || e.getType() == null || isBlank(e.getName())) {
                throw new WorkshopValidationException("Failed to import workshop: every element needs id, type and name");
            }
            if (!elementIds.add(e.getId())) {
                throw new WorkshopValidationException("Failed to import workshop: duplicate element id " + e.getId());
            }
        }
        for (BoundedContext ctx : workshop.getBoundedContexts()) {
            if (ctx == null || isBlank(ctx.getId()) || isBlank(ctx.getName())) {
                throw new WorkshopValidationException("Failed to import workshop: every bounded context needs id and name");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
