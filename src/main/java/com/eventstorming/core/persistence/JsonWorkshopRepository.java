package com.eventstorming.core.persistence;

import com.eventstorming.core.model.Timestamps;
import com.eventstorming.core.model.Workshop;
import com.eventstorming.core.model.WorkshopSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.util.Comparator;

/**
 * Shared JSON encoding for repositories that keep workshops as serialized
 * documents. Decoding always runs the {@link SchemaMigrator} first.
 */
abstract class JsonWorkshopRepository implements WorkshopRepository {

    static final Comparator<WorkshopSummary> NEWEST_FIRST =
            Comparator.comparing(WorkshopSummary::updatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    protected final ObjectMapper objectMapper;
    protected final SchemaMigrator migrator;
    protected final Clock clock;

    protected JsonWorkshopRepository(ObjectMapper objectMapper, SchemaMigrator migrator, Clock clock) {
        this.objectMapper = objectMapper;
        this.migrator = migrator;
        this.clock = clock;
    }

    protected Workshop decode(String workshopId, String json) {
        try {
            JsonNode tree = objectMapper.readTree(json);
            if (!(tree instanceof ObjectNode root)) {
                throw new WorkshopStorageException("Stored workshop " + workshopId + " is not a JSON object", null);
            }
            migrator.migrate(root);
            return objectMapper.treeToValue(root, Workshop.class);
        } catch (JsonProcessingException e) {
            throw new WorkshopStorageException("Stored workshop " + workshopId + " is unreadable", e);
        }
    }

    protected String encode(Workshop workshop) {
        workshop.getMetadata().setUpdatedAt(Timestamps.now(clock));
        try {
            return objectMapper.writeValueAsString(workshop);
        } catch (JsonProcessingException e) {
            throw new WorkshopStorageException("Failed to serialize workshop " + workshop.getId(), e);
        }
    }

    /**
     * Builds a listing row from the raw document without binding the full model.
     */
    protected WorkshopSummary summarize(String json) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(json);
        JsonNode metadata = root.path("metadata");
        if (!metadata.hasNonNull("id") || !metadata.hasNonNull("name")) {
            throw new IllegalArgumentException("metadata.id and metadata.name are required");
        }
        return new WorkshopSummary(
                metadata.get("id").asText(),
                metadata.get("name").asText(),
                metadata.path("domain").asText(""),
                metadata.path("created_at").asText(null),
                metadata.path("updated_at").asText(null),
                root.path("elements").size(),
                root.path("bounded_contexts").size()
        );
    }
}
