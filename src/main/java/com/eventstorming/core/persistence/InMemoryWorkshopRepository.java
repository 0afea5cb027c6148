package com.eventstorming.core.persistence;

import com.eventstorming.core.model.NotFoundException;
import com.eventstorming.core.model.Workshop;
import com.eventstorming.core.model.WorkshopSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps serialized snapshots in memory. Each {@link #load} decodes a new copy,
 * so callers never share mutable state. Contents are lost on restart.
 */
public class InMemoryWorkshopRepository extends JsonWorkshopRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkshopRepository.class);

    private final ConcurrentHashMap<String, String> documents = new ConcurrentHashMap<>();

    public InMemoryWorkshopRepository(ObjectMapper objectMapper, SchemaMigrator migrator, Clock clock) {
        super(objectMapper, migrator, clock);
    }

    @Override
    public Workshop load(String workshopId) {
        String json = workshopId != null ? documents.get(workshopId) : null;
        if (json == null) {
            throw new NotFoundException(NotFoundException.Kind.WORKSHOP, workshopId);
        }
        return decode(workshopId, json);
    }

    @Override
    public void save(Workshop workshop) {
        documents.put(workshop.getId(), encode(workshop));
    }

    @Override
    public boolean exists(String workshopId) {
        return workshopId != null && documents.containsKey(workshopId);
    }

    @Override
    public List<WorkshopSummary> list() {
        List<WorkshopSummary> summaries = new ArrayList<>();
        for (var entry : documents.entrySet()) {
            try {
                summaries.add(summarize(entry.getValue()));
            } catch (JsonProcessingException | RuntimeException e) {
                log.warn("Skipping unreadable workshop {}: {}", entry.getKey(), e.getMessage());
            }
        }
        summaries.sort(NEWEST_FIRST);
        return summaries;
    }

    /**
     * Stores a raw document as-is, bypassing encoding. Used to seed legacy shapes.
     */
    public void putRaw(String workshopId, String json) {
        documents.put(workshopId, json);
    }
}
