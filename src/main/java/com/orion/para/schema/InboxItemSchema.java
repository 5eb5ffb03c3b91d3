package com.orion.para.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.orion.para.models.InboxItem;

import java.util.List;
import java.util.Set;

import static com.orion.para.schema.SchemaSupport.*;

public final class InboxItemSchema extends ObjectSchema<InboxItem> {
    public static final Set<String> TYPES = Set.of("task", "note", "idea", "reference", "capture");

    public InboxItemSchema() {
        super("inbox_item", InboxItem.class);
    }

    @Override
    protected void validateFields(JsonNode node, List<String> errors) {
        requirePrefix(node, "id", "inbox_", errors);
        requireText(node, "title", errors);
        requireEnum(node, "type", TYPES, errors);
        optionalText(node, "content", errors);
        optionalText(node, "source", errors);
        optionalIntRange(node, "priority_score", 0, 100, errors);
        optionalBoolean(node, "processed", errors);
        optionalText(node, "target_project", errors);
        optionalText(node, "target_area", errors);
        optionalTimestamp(node, "due_date", errors);
        requireTimestamp(node, "created_at", errors);
        requireTimestamp(node, "updated_at", errors);
        optionalTextArray(node, "tags", errors);
    }
}
