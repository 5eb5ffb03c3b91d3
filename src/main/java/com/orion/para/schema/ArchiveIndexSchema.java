package com.orion.para.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.orion.para.models.ArchiveIndex;

import java.util.List;

import static com.orion.para.schema.SchemaSupport.*;

public final class ArchiveIndexSchema extends ObjectSchema<ArchiveIndex> {

    public ArchiveIndexSchema() {
        super("archive_index", ArchiveIndex.class);
    }

    @Override
    protected void validateFields(JsonNode node, List<String> errors) {
        requirePositiveInt(node, "version", errors);
        requireTimestamp(node, "generated_at", errors);

        JsonNode items = node.path("archived_items");
        if (!items.isArray()) {
            errors.add("archived_items:missing");
        } else {
            for (int i = 0; i < items.size(); i++) {
                JsonNode item = items.get(i);
                String label = "archived_items[" + i + "].";
                if (!item.isObject()) {
                    errors.add(label + "item:not_mapping");
                    continue;
                }
                ArchivedItemSchema.validateItem(item, errors, label);
            }
        }

        JsonNode stats = node.path("stats");
        if (!stats.isObject()) {
            errors.add("stats:missing");
            return;
        }
        requireNonNegativeInt(stats, "total", errors, "stats.total");
        requireNonNegativeInt(stats, "projects", errors, "stats.projects");
        requireNonNegativeInt(stats, "areas", errors, "stats.areas");
    }
}
