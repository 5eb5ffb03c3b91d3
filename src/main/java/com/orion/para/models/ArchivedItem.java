package com.orion.para.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the archive index.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArchivedItem {
    public static final String TYPE_PROJECT = "project";
    public static final String TYPE_AREA = "area";

    private String id;
    private String type; // project | area
    @JsonProperty("original_path")
    private String originalPath;
    @JsonProperty("archived_to")
    private String archivedTo;
    @JsonProperty("archived_at")
    private String archivedAt;
    private String reason; // completed | cancelled | inactive | manual
    private String title;
    private String notes;

    public ArchivedItem() {
    }

    public ArchivedItem(String id, String type, String originalPath, String archivedTo,
                        String archivedAt, String reason) {
        this.id = id;
        this.type = type;
        this.originalPath = originalPath;
        this.archivedTo = archivedTo;
        this.archivedAt = archivedAt;
        this.reason = reason;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getOriginalPath() {
        return originalPath;
    }

    public void setOriginalPath(String originalPath) {
        this.originalPath = originalPath;
    }

    public String getArchivedTo() {
        return archivedTo;
    }

    public void setArchivedTo(String archivedTo) {
        this.archivedTo = archivedTo;
    }

    public String getArchivedAt() {
        return archivedAt;
    }

    public void setArchivedAt(String archivedAt) {
        this.archivedAt = archivedAt;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
