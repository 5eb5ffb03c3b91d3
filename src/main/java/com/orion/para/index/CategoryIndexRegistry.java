package com.orion.para.index;

import java.util.Optional;

/**
 * Where each category keeps its index file and which list field it stores.
 */
public class CategoryIndexRegistry {

    private final String rootName;

    public CategoryIndexRegistry(String rootName) {
        this.rootName = rootName;
    }

    public String getRootName() {
        return rootName;
    }

    public String indexPathFor(EntityType type) {
        return rootName + "/" + type.getDirectory() + "/" + type.getIndexFileName();
    }

    public String listKeyFor(EntityType type) {
        return type.getListKey();
    }

    public Optional<EntityType> typeOf(String path) {
        return EntityType.fromPath(path, rootName);
    }

    /**
     * True when {@code path} is the index file of its own category.
     */
    public boolean isIndexFile(String path) {
        return typeOf(path).map(type -> indexPathFor(type).equals(path)).orElse(false);
    }

    public String archiveIndexPath() {
        return indexPathFor(EntityType.ARCHIVE);
    }
}
