package com.orion.para.schema;

import java.util.List;

/**
 * Carries a failed {@link ValidationResult} as the cause of a validation error.
 */
public class SchemaValidationException extends Exception {
    private final String schemaName;
    private final ValidationResult result;

    public SchemaValidationException(String schemaName, ValidationResult result) {
        super(schemaName + " validation failed: " + result);
        this.schemaName = schemaName;
        this.result = result;
    }

    public SchemaValidationException(String schemaName, String message, Throwable cause) {
        super(schemaName + " validation failed: " + message, cause);
        this.schemaName = schemaName;
        this.result = ValidationResult.of(List.of(message));
    }

    public String getSchemaName() {
        return schemaName;
    }

    public ValidationResult getResult() {
        return result;
    }
}
