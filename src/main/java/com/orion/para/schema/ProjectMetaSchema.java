package com.orion.para.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.orion.para.models.ProjectMeta;

import java.util.List;
import java.util.Set;

import static com.orion.para.schema.SchemaSupport.*;

public final class ProjectMetaSchema extends ObjectSchema<ProjectMeta> {
    public static final Set<String> STATUSES = Set.of("active", "paused", "completed", "cancelled");
    public static final Set<String> PRIORITIES = Set.of("high", "medium", "low");

    public ProjectMetaSchema() {
        super("project", ProjectMeta.class);
    }

    @Override
    protected void validateFields(JsonNode node, List<String> errors) {
        requirePrefix(node, "id", "proj_", errors);
        requireText(node, "name", errors);
        optionalText(node, "description", errors);
        requireEnum(node, "status", STATUSES, errors);
        requireEnum(node, "priority", PRIORITIES, errors);
        optionalText(node, "area", errors);
        optionalTimestamp(node, "deadline", errors);
        requireTimestamp(node, "created_at", errors);
        requireTimestamp(node, "updated_at", errors);
        optionalTextArray(node, "tags", errors);

        JsonNode stakeholders = node.path("stakeholders");
        if (stakeholders.isMissingNode() || stakeholders.isNull()) {
            return;
        }
        if (!stakeholders.isArray()) {
            errors.add("stakeholders:not_array");
            return;
        }
        for (int i = 0; i < stakeholders.size(); i++) {
            JsonNode stakeholder = stakeholders.get(i);
            String label = "stakeholders[" + i + "]";
            if (!stakeholder.isObject()) {
                errors.add(label + ":not_mapping");
                continue;
            }
            requireText(stakeholder, "name", errors, label + ".name");
            requireText(stakeholder, "role", errors, label + ".role");
        }
    }
}
