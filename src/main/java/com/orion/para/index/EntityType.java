package com.orion.para.index;

import java.util.Optional;

/**
 * Entity kinds that own an index file, keyed by the directory they live under.
 */
public enum EntityType {
    PROJECT("Projects", "_index.yaml", "projects"),
    AREA("Areas", "_index.yaml", "areas"),
    ARCHIVE("Archive", "_index.yaml", "archived_items"),
    INBOX("Inbox", "_queue.yaml", "items"),
    CONTACT("Resources/contacts", "_index.yaml", "contacts"),
    NOTE("Resources/notes", "_index.yaml", "notes"),
    TEMPLATE("Resources/templates", "_index.yaml", "templates"),
    PROCEDURE("Resources/procedures", "_index.yaml", "procedures"),
    PREFERENCE("Resources/preferences", "_index.yaml", "preferences");

    private final String directory;
    private final String indexFileName;
    private final String listKey;

    EntityType(String directory, String indexFileName, String listKey) {
        this.directory = directory;
        this.indexFileName = indexFileName;
        this.listKey = listKey;
    }

    public String getDirectory() {
        return directory;
    }

    public String getIndexFileName() {
        return indexFileName;
    }

    public String getListKey() {
        return listKey;
    }

    /**
     * The archive index is owned by the archival engine, which maintains its stats.
     */
    public boolean isWriterIndexed() {
        return this != ARCHIVE;
    }

    /**
     * Infer the entity type from a namespace-relative path. The path must be
     * {@code <root>/<category dir>/<something>}; Resources subdirectories are
     * matched before anything else under Resources, which itself has no type.
     */
    public static Optional<EntityType> fromPath(String path, String rootName) {
        if (path == null || rootName == null || !path.startsWith(rootName + "/")) {
            return Optional.empty();
        }
        String[] segments = path.substring(rootName.length() + 1).split("/");
        if (segments.length < 2) {
            return Optional.empty();
        }
        if ("Resources".equals(segments[0])) {
            if (segments.length < 3) {
                return Optional.empty();
            }
            return match("Resources/" + segments[1]);
        }
        return match(segments[0]);
    }

    private static Optional<EntityType> match(String directory) {
        for (EntityType type : values()) {
            if (type.directory.equals(directory)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
