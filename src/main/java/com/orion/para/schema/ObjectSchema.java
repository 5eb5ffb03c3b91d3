package com.orion.para.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for schemas whose documents are YAML mappings.
 */
public abstract class ObjectSchema<T> implements EntitySchema<T> {

    private final String name;
    private final Class<T> type;

    protected ObjectSchema(String name, Class<T> type) {
        this.name = name;
        this.type = type;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Class<T> getType() {
        return type;
    }

    @Override
    public ValidationResult validate(JsonNode node) {
        List<String> errors = new ArrayList<>();
        if (node == null || node.isMissingNode() || node.isNull()) {
            errors.add(name + ":missing");
            return ValidationResult.of(errors);
        }
        if (!node.isObject()) {
            errors.add(name + ":not_mapping");
            return ValidationResult.of(errors);
        }
        validateFields(node, errors);
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.of(errors);
    }

    protected abstract void validateFields(JsonNode node, List<String> errors);
}
