package com.orion.para.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Set;

final class SchemaSupport {

    private SchemaSupport() {
    }

    static void requireText(JsonNode node, String field, List<String> errors) {
        requireText(node, field, errors, field);
    }

    static void requireText(JsonNode node, String field, List<String> errors, String label) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || !value.isTextual() || value.asText().isEmpty()) {
            errors.add(label + ":missing");
        }
    }

    static void requirePrefix(JsonNode node, String field, String prefix, List<String> errors) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || !value.isTextual()) {
            errors.add(field + ":missing");
        } else if (!value.asText().startsWith(prefix)) {
            errors.add(field + ":prefix_" + prefix);
        }
    }

    static void requireEnum(JsonNode node, String field, Set<String> allowed, List<String> errors) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || !value.isTextual()) {
            errors.add(field + ":missing");
        } else if (!allowed.contains(value.asText())) {
            errors.add(field + ":invalid");
        }
    }

    static void optionalEnum(JsonNode node, String field, Set<String> allowed, List<String> errors) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return;
        }
        if (!value.isTextual() || !allowed.contains(value.asText())) {
            errors.add(field + ":invalid");
        }
    }

    static void optionalText(JsonNode node, String field, List<String> errors) {
        JsonNode value = node.path(field);
        if (!value.isMissingNode() && !value.isNull() && !value.isTextual()) {
            errors.add(field + ":not_text");
        }
    }

    static void requireTimestamp(JsonNode node, String field, List<String> errors) {
        requireTimestamp(node, field, errors, field);
    }

    static void requireTimestamp(JsonNode node, String field, List<String> errors, String label) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || !value.isTextual()) {
            errors.add(label + ":missing");
        } else if (!isTimestamp(value.asText())) {
            errors.add(label + ":not_datetime");
        }
    }

    static void optionalTimestamp(JsonNode node, String field, List<String> errors) {
        optionalTimestamp(node, field, errors, field);
    }

    static void optionalTimestamp(JsonNode node, String field, List<String> errors, String label) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return;
        }
        if (!value.isTextual() || !isTimestamp(value.asText())) {
            errors.add(label + ":not_datetime");
        }
    }

    static void optionalTextArray(JsonNode node, String field, List<String> errors) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return;
        }
        if (!value.isArray()) {
            errors.add(field + ":not_array");
            return;
        }
        for (int i = 0; i < value.size(); i++) {
            if (!value.get(i).isTextual()) {
                errors.add(field + "[" + i + "]:not_text");
            }
        }
    }

    static void optionalBoolean(JsonNode node, String field, List<String> errors) {
        JsonNode value = node.path(field);
        if (!value.isMissingNode() && !value.isNull() && !value.isBoolean()) {
            errors.add(field + ":not_boolean");
        }
    }

    static void optionalIntRange(JsonNode node, String field, int min, int max, List<String> errors) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return;
        }
        if (!value.isIntegralNumber()) {
            errors.add(field + ":not_int");
        } else if (value.asLong() < min || value.asLong() > max) {
            errors.add(field + ":out_of_range");
        }
    }

    static void requireNonNegativeInt(JsonNode node, String field, List<String> errors, String label) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || !value.isIntegralNumber()) {
            errors.add(label + ":missing");
        } else if (value.asLong() < 0) {
            errors.add(label + ":negative");
        }
    }

    static void requirePositiveInt(JsonNode node, String field, List<String> errors) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || !value.isIntegralNumber()) {
            errors.add(field + ":missing");
        } else if (value.asLong() <= 0) {
            errors.add(field + ":not_positive");
        }
    }

    static boolean isTimestamp(String text) {
        try {
            OffsetDateTime.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
