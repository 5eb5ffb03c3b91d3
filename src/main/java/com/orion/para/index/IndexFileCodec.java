package com.orion.para.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.orion.para.models.ArchiveIndex;
import com.orion.para.storage.YamlCodec;

import java.io.IOException;

/**
 * Reads and writes index documents.
 *
 * Category index layout:
 *   version: 1
 *   updated_at: 2026-01-27T00:00:00Z
 *   projects:          (list key varies by category)
 *     - id: proj_abc
 *       ...
 *
 * The archive index is bound to {@link ArchiveIndex}.
 */
public class IndexFileCodec {

    public static final int INDEX_VERSION = 1;

    private final YamlCodec yaml;

    public IndexFileCodec(YamlCodec yaml) {
        this.yaml = yaml;
    }

    public ObjectNode newIndex(String listKey, String updatedAt) {
        ObjectNode index = yaml.getMapper().createObjectNode();
        index.put("version", INDEX_VERSION);
        index.put("updated_at", updatedAt);
        index.putArray(listKey);
        return index;
    }

    /**
     * Parse a category index. A document that is not a mapping is rejected.
     */
    public ObjectNode parseIndex(String text) throws IOException {
        JsonNode node = yaml.parse(text);
        if (!node.isObject()) {
            throw new IOException("Index document is not a mapping");
        }
        return (ObjectNode) node;
    }

    public String serialize(JsonNode index) throws JsonProcessingException {
        return yaml.stringify(index);
    }

    /**
     * Replace the entry whose id matches {@code entity}'s id, or append it.
     * Returns false, leaving the index untouched, when the entity has no id.
     */
    public boolean upsert(ObjectNode index, String listKey, JsonNode entity, String updatedAt) throws IOException {
        String id = idOf(entity);
        if (id == null) {
            return false;
        }
        ArrayNode list = listOf(index, listKey);
        // First match is replaced in place; stray duplicates after it are dropped.
        boolean replaced = false;
        for (int i = 0; i < list.size(); i++) {
            if (!id.equals(idOf(list.get(i)))) {
                continue;
            }
            if (!replaced) {
                list.set(i, entity.deepCopy());
                replaced = true;
            } else {
                list.remove(i--);
            }
        }
        if (!replaced) {
            list.add(entity.deepCopy());
        }
        index.put("updated_at", updatedAt);
        return true;
    }

    /**
     * Drop every entry with the given id. Returns true when something was removed.
     */
    public boolean remove(ObjectNode index, String listKey, String id, String updatedAt) throws IOException {
        if (id == null) {
            return false;
        }
        ArrayNode list = listOf(index, listKey);
        boolean removed = false;
        for (int i = list.size() - 1; i >= 0; i--) {
            if (id.equals(idOf(list.get(i)))) {
                list.remove(i);
                removed = true;
            }
        }
        if (removed) {
            index.put("updated_at", updatedAt);
        }
        return removed;
    }

    public boolean contains(ObjectNode index, String listKey, String id) {
        JsonNode list = index.path(listKey);
        if (!list.isArray()) {
            return false;
        }
        for (JsonNode item : list) {
            if (id.equals(idOf(item))) {
                return true;
            }
        }
        return false;
    }

    public ArchiveIndex parseArchiveIndex(String text) throws IOException {
        JsonNode node = yaml.parse(text);
        if (!node.isObject()) {
            throw new IOException("Archive index is not a mapping");
        }
        return yaml.convert(node, ArchiveIndex.class);
    }

    public String serializeArchiveIndex(ArchiveIndex index) throws JsonProcessingException {
        return yaml.stringify(index);
    }

    public static String idOf(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode id = node.path("id");
        return id.isTextual() ? id.asText() : null;
    }

    private ArrayNode listOf(ObjectNode index, String listKey) throws IOException {
        JsonNode list = index.get(listKey);
        if (list == null || list.isNull()) {
            return index.putArray(listKey);
        }
        if (!list.isArray()) {
            throw new IOException("Index field '" + listKey + "' is not a list");
        }
        return (ArrayNode) list;
    }
}
