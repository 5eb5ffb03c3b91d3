package com.orion.para.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.orion.para.storage.AtomicFileWriter;
import com.orion.para.storage.ParaFileSystem;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;

/**
 * Read-modify-write of category index files. No lock is held between the
 * read and the rename, so concurrent updaters are last-writer-wins.
 */
public class CategoryIndexUpdater {

    private final ParaFileSystem fileSystem;
    private final CategoryIndexRegistry registry;
    private final IndexFileCodec codec;
    private final AtomicFileWriter writer;
    private final Clock clock;

    public CategoryIndexUpdater(ParaFileSystem fileSystem, CategoryIndexRegistry registry,
                                IndexFileCodec codec, Clock clock) {
        this.fileSystem = fileSystem;
        this.registry = registry;
        this.codec = codec;
        this.writer = new AtomicFileWriter(fileSystem);
        this.clock = clock;
    }

    public CategoryIndexRegistry getRegistry() {
        return registry;
    }

    /**
     * Load a category index, or a fresh empty one when the file does not exist yet
     * or is blank.
     */
    public ObjectNode load(EntityType type) throws IOException {
        String indexPath = registry.indexPathFor(type);
        if (!fileSystem.exists(indexPath)) {
            return codec.newIndex(type.getListKey(), now());
        }
        return parseOrNew(type, fileSystem.readString(indexPath));
    }

    public void upsert(EntityType type, JsonNode entity) throws IOException {
        ObjectNode index = load(type);
        if (codec.upsert(index, type.getListKey(), entity, now())) {
            writer.write(registry.indexPathFor(type), codec.serialize(index));
        }
    }

    /**
     * Remove an id from a category index. Returns false when the index does not
     * exist or holds no entry for the id.
     */
    public boolean remove(EntityType type, String id) throws IOException {
        String indexPath = registry.indexPathFor(type);
        if (!fileSystem.exists(indexPath)) {
            return false;
        }
        ObjectNode index = parseOrNew(type, fileSystem.readString(indexPath));
        if (!codec.remove(index, type.getListKey(), id, now())) {
            return false;
        }
        writer.write(indexPath, codec.serialize(index));
        return true;
    }

    private ObjectNode parseOrNew(EntityType type, String content) throws IOException {
        if (content == null || content.isBlank()) {
            return codec.newIndex(type.getListKey(), now());
        }
        return codec.parseIndex(content);
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
