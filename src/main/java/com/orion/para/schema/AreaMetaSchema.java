package com.orion.para.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.orion.para.models.AreaMeta;

import java.util.List;
import java.util.Set;

import static com.orion.para.schema.SchemaSupport.*;

public final class AreaMetaSchema extends ObjectSchema<AreaMeta> {
    public static final Set<String> STATUSES = Set.of("active", "dormant");
    public static final Set<String> REVIEW_CADENCES = Set.of("daily", "weekly", "monthly", "quarterly");

    public AreaMetaSchema() {
        super("area", AreaMeta.class);
    }

    @Override
    protected void validateFields(JsonNode node, List<String> errors) {
        requirePrefix(node, "id", "area_", errors);
        requireText(node, "name", errors);
        optionalText(node, "description", errors);
        requireEnum(node, "status", STATUSES, errors);
        optionalTextArray(node, "responsibilities", errors);
        optionalEnum(node, "review_cadence", REVIEW_CADENCES, errors);
        requireTimestamp(node, "created_at", errors);
        requireTimestamp(node, "updated_at", errors);
        optionalTextArray(node, "tags", errors);

        JsonNode goals = node.path("goals");
        if (goals.isMissingNode() || goals.isNull()) {
            return;
        }
        if (!goals.isArray()) {
            errors.add("goals:not_array");
            return;
        }
        for (int i = 0; i < goals.size(); i++) {
            JsonNode goal = goals.get(i);
            String label = "goals[" + i + "]";
            if (!goal.isObject()) {
                errors.add(label + ":not_mapping");
                continue;
            }
            requireText(goal, "description", errors, label + ".description");
            requireText(goal, "status", errors, label + ".status");
            optionalTimestamp(goal, "target_date", errors, label + ".target_date");
        }
    }
}
