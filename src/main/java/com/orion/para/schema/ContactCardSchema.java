package com.orion.para.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.orion.para.models.ContactCard;

import java.util.List;
import java.util.Set;

import static com.orion.para.schema.SchemaSupport.*;

public final class ContactCardSchema extends ObjectSchema<ContactCard> {
    public static final Set<String> TYPES = Set.of("person", "organization");

    public ContactCardSchema() {
        super("contact", ContactCard.class);
    }

    @Override
    protected void validateFields(JsonNode node, List<String> errors) {
        requirePrefix(node, "id", "cont_", errors);
        requireText(node, "name", errors);
        requireEnum(node, "type", TYPES, errors);
        for (String field : List.of("email", "phone", "company", "role", "relationship", "notes")) {
            optionalText(node, field, errors);
        }
        requireTimestamp(node, "created_at", errors);
        requireTimestamp(node, "updated_at", errors);
        optionalTextArray(node, "tags", errors);
        optionalTextArray(node, "projects", errors);
    }
}
