package com.eventstorming.core.persistence;

import com.eventstorming.core.model.WorkshopMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Upgrades raw stored workshop JSON to the current schema.
 * <p>
 * Version 1 elements carried a separate {@code description}. It is folded into
 * {@code notes}, description first and existing notes after a blank line, and
 * the metadata is stamped with {@link WorkshopMetadata#CURRENT_SCHEMA_VERSION}.
 */
@Component
public class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    private static final String LEGACY_VERSION = "1.0";

    /**
     * Migrates the tree in place.
     *
     * @return true if the tree was changed
     */
    public boolean migrate(ObjectNode root) {
        JsonNode metadata = root.get("metadata");
        String version = metadata != null && metadata.hasNonNull("schema_version")
                ? metadata.get("schema_version").asText()
                : LEGACY_VERSION;
        if (WorkshopMetadata.CURRENT_SCHEMA_VERSION.equals(version)) {
            return false;
        }

        int folded = 0;
        JsonNode elements = root.get("elements");
        if (elements != null && elements.isArray()) {
            for (JsonNode node : elements) {
                if (!(node instanceof ObjectNode element)) {
                    continue;
                }
                if (element.has("description")) {
                    String description = text(element.get("description")).strip();
                    String notes = text(element.get("notes")).strip();
                    if (!description.isEmpty() && !notes.isEmpty()) {
                        element.put("notes", description + "\n\n" + notes);
                    } else if (!description.isEmpty()) {
                        element.put("notes", description);
                    } else if (notes.isEmpty()) {
                        element.put("notes", "");
                    }
                    element.remove("description");
                    folded++;
                }
                if (!element.hasNonNull("notes")) {
                    element.put("notes", "");
                }
            }
        }

        if (metadata instanceof ObjectNode meta) {
            meta.put("schema_version", WorkshopMetadata.CURRENT_SCHEMA_VERSION);
        }
        log.info("Migrated workshop from schema {} to {} ({} element description(s) folded into notes)",
                version, WorkshopMetadata.CURRENT_SCHEMA_VERSION, folded);
        return true;
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? "" : node.asText();
    }
}
