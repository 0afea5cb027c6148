package com.eventstorming.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Descriptive header of a workshop snapshot.
 */
public class WorkshopMetadata {

    public static final String CURRENT_SCHEMA_VERSION = "2.0";

    private String id;
    private String name;
    private String description = "";
    private String domain = "";
    private String createdAt;
    private String updatedAt;
    private List<String> facilitators = new ArrayList<>();
    private String schemaVersion = CURRENT_SCHEMA_VERSION;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description != null ? description : ""; }
    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain != null ? domain : ""; }
    public String getCreatedAt() { return createdAt; }
    public void setCreatedAt(String createdAt) { this.createdAt = createdAt; }
    public String getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(String updatedAt) { this.updatedAt = updatedAt; }
    public List<String> getFacilitators() { return facilitators; }
    public void setFacilitators(List<String> facilitators) {
        this.facilitators = facilitators != null ? new ArrayList<>(facilitators) : new ArrayList<>();
    }
    public String getSchemaVersion() { return schemaVersion; }
    public void setSchemaVersion(String schemaVersion) { this.schemaVersion = schemaVersion; }
}
