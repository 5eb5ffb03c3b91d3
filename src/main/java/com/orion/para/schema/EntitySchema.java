package com.orion.para.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Validation capability for one entity shape, and the Java type it maps to.
 */
public interface EntitySchema<T> {

    String getName();

    Class<T> getType();

    ValidationResult validate(JsonNode node);
}
