package com.orion.para.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.orion.para.models.ArchivedItem;

import java.util.List;
import java.util.Set;

import static com.orion.para.schema.SchemaSupport.*;

public final class ArchivedItemSchema extends ObjectSchema<ArchivedItem> {
    public static final Set<String> TYPES = Set.of(ArchivedItem.TYPE_PROJECT, ArchivedItem.TYPE_AREA);
    public static final Set<String> REASONS = Set.of("completed", "cancelled", "inactive", "manual");

    public ArchivedItemSchema() {
        super("archived_item", ArchivedItem.class);
    }

    @Override
    protected void validateFields(JsonNode node, List<String> errors) {
        validateItem(node, errors, "");
    }

    static void validateItem(JsonNode node, List<String> errors, String prefix) {
        requireText(node, "id", errors, prefix + "id");
        JsonNode type = node.path("type");
        if (!type.isTextual() || !TYPES.contains(type.asText())) {
            errors.add(prefix + "type:invalid");
        }
        requireText(node, "original_path", errors, prefix + "original_path");
        requireText(node, "archived_to", errors, prefix + "archived_to");
        requireTimestamp(node, "archived_at", errors, prefix + "archived_at");
        JsonNode reason = node.path("reason");
        if (!reason.isTextual() || !REASONS.contains(reason.asText())) {
            errors.add(prefix + "reason:invalid");
        }
    }
}
