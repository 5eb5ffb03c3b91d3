package com.orion.para.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Archive-wide index document, {@code Archive/_index.yaml}. Items and stats
 * are always written together in one document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArchiveIndex {
    private int version = 1;
    @JsonProperty("generated_at")
    private String generatedAt;
    @JsonProperty("archived_items")
    private List<ArchivedItem> archivedItems = new ArrayList<>();
    private ArchiveStats stats = new ArchiveStats();

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public String getGeneratedAt() {
        return generatedAt;
    }

    public void setGeneratedAt(String generatedAt) {
        this.generatedAt = generatedAt;
    }

    public List<ArchivedItem> getArchivedItems() {
        return archivedItems;
    }

    public void setArchivedItems(List<ArchivedItem> archivedItems) {
        this.archivedItems = archivedItems != null ? archivedItems : new ArrayList<>();
    }

    public ArchiveStats getStats() {
        return stats;
    }

    public void setStats(ArchiveStats stats) {
        this.stats = stats != null ? stats : new ArchiveStats();
    }

    public void append(ArchivedItem item, String generatedAt) {
        archivedItems.add(item);
        stats.increment(item.getType());
        this.generatedAt = generatedAt;
    }
}
