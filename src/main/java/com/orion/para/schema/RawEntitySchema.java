package com.orion.para.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Accepts any mapping that carries a textual {@code id}.
 */
public final class RawEntitySchema extends ObjectSchema<JsonNode> {

    public RawEntitySchema() {
        super("entity", JsonNode.class);
    }

    @Override
    protected void validateFields(JsonNode node, List<String> errors) {
        SchemaSupport.requireText(node, "id", errors);
    }
}
