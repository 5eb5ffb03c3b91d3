package com.orion.para.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ArchiveStats {
    private int total;
    private int projects;
    private int areas;

    public ArchiveStats() {
    }

    public ArchiveStats(int total, int projects, int areas) {
        this.total = total;
        this.projects = projects;
        this.areas = areas;
    }

    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
    }

    public int getProjects() {
        return projects;
    }

    public void setProjects(int projects) {
        this.projects = projects;
    }

    public int getAreas() {
        return areas;
    }

    public void setAreas(int areas) {
        this.areas = areas;
    }

    /**
     * Count one more archived item of the given type.
     */
    public void increment(String type) {
        total++;
        if (ArchivedItem.TYPE_PROJECT.equals(type)) {
            projects++;
        } else if (ArchivedItem.TYPE_AREA.equals(type)) {
            areas++;
        }
    }
}
