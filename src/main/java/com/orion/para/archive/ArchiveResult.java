package com.orion.para.archive;

public final class ArchiveResult {
    private final String archivedTo;
    private final String archivedAt;
    private final String originalPath;

    public ArchiveResult(String archivedTo, String archivedAt, String originalPath) {
        this.archivedTo = archivedTo;
        this.archivedAt = archivedAt;
        this.originalPath = originalPath;
    }

    /**
     * Namespace-relative destination, e.g. {@code Orion/Archive/projects/2026-01/my-project}.
     */
    public String getArchivedTo() {
        return archivedTo;
    }

    public String getArchivedAt() {
        return archivedAt;
    }

    public String getOriginalPath() {
        return originalPath;
    }
}
