package com.orion.para.paths;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Logical categories addressable through the path resolver, in lookup order.
 */
public enum ParaCategory {
    PROJECTS("projects", "Projects", false),
    AREAS("areas", "Areas", false),
    RESOURCES("resources", "Resources", false),
    ARCHIVE("archive", "Archive", false),
    INBOX("inbox", "Inbox", false),
    CONTACTS("contacts", "Resources/contacts", true),
    TEMPLATES("templates", "Resources/templates", true),
    NOTES("notes", "Resources/notes", true),
    PROCEDURES("procedures", "Resources/procedures", true),
    PREFERENCES("preferences", "Resources/preferences", true);

    public static final String ENTITY_EXTENSION = ".yaml";

    private static final List<String> NAMES;

    static {
        List<String> names = new ArrayList<>();
        for (ParaCategory category : values()) {
            names.add(category.getLogicalName());
        }
        NAMES = Collections.unmodifiableList(names);
    }

    private final String logicalName;
    private final String directory;
    private final boolean entityFiles;

    ParaCategory(String logicalName, String directory, boolean entityFiles) {
        this.logicalName = logicalName;
        this.directory = directory;
        this.entityFiles = entityFiles;
    }

    /**
     * Lower-case name used in logical addresses, e.g. {@code contacts}.
     */
    public String getLogicalName() {
        return logicalName;
    }

    /**
     * Canonical directory below the namespace root, e.g. {@code Resources/contacts}.
     */
    public String getDirectory() {
        return directory;
    }

    /**
     * Whether entries are single files that take the storage extension.
     */
    public boolean hasEntityFiles() {
        return entityFiles;
    }

    public static Optional<ParaCategory> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (ParaCategory category : values()) {
            if (category.getLogicalName().equals(lower)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    public static List<String> names() {
        return NAMES;
    }
}
