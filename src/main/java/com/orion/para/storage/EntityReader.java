package com.orion.para.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.orion.para.AppLogger;
import com.orion.para.ParaErrorCode;
import com.orion.para.ParaResult;
import com.orion.para.schema.EntitySchema;
import com.orion.para.schema.SchemaValidationException;
import com.orion.para.schema.ValidationResult;

import java.io.IOException;

/**
 * Loads a single entity file and checks it against a schema.
 */
public class EntityReader {

    private final ParaFileSystem fileSystem;
    private final YamlCodec yaml;

    public EntityReader(ParaFileSystem fileSystem, YamlCodec yaml) {
        this.fileSystem = fileSystem;
        this.yaml = yaml;
    }

    public <T> ParaResult<T> read(String path, EntitySchema<T> schema) {
        return read(path, schema, ReadOptions.defaults());
    }

    public <T> ParaResult<T> read(String path, EntitySchema<T> schema, ReadOptions options) {
        try {
            boolean exists;
            try {
                exists = fileSystem.exists(path);
            } catch (IOException e) {
                return ParaResult.err(ParaErrorCode.FS_ERROR,
                    "Failed to check file existence: " + AppLogger.describe(e), e);
            }
            if (!exists) {
                return ParaResult.err(ParaErrorCode.NOT_FOUND, "File not found: ~/" + path);
            }

            String content;
            try {
                content = fileSystem.readString(path);
            } catch (IOException e) {
                return ParaResult.err(ParaErrorCode.READ_ERROR, "Failed to read file: " + AppLogger.describe(e), e);
            }

            JsonNode parsed;
            try {
                parsed = yaml.parse(content);
            } catch (JsonProcessingException e) {
                return ParaResult.err(ParaErrorCode.PARSE_ERROR, "Failed to parse YAML: " + AppLogger.describe(e), e);
            }

            if (options.isValidate()) {
                ValidationResult validation = schema.validate(parsed);
                if (!validation.isValid()) {
                    SchemaValidationException cause = new SchemaValidationException(schema.getName(), validation);
                    return ParaResult.err(ParaErrorCode.VALIDATION_ERROR, "Validation failed: " + validation, cause);
                }
            }

            if (parsed.isNull()) {
                return ParaResult.err(ParaErrorCode.PARSE_ERROR, "File is empty: ~/" + path);
            }

            return bind(parsed, schema, options);
        } catch (RuntimeException e) {
            return ParaResult.err(ParaErrorCode.FS_ERROR, "Unexpected error: " + AppLogger.describe(e), e);
        }
    }

    private <T> ParaResult<T> bind(JsonNode parsed, EntitySchema<T> schema, ReadOptions options) {
        if (schema.getType().isInstance(parsed)) {
            return ParaResult.ok(schema.getType().cast(parsed));
        }
        try {
            return ParaResult.ok(yaml.convert(parsed, schema.getType()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            if (options.isValidate()) {
                SchemaValidationException cause =
                    new SchemaValidationException(schema.getName(), AppLogger.describe(e), e);
                return ParaResult.err(ParaErrorCode.VALIDATION_ERROR, "Validation failed: " + AppLogger.describe(e), cause);
            }
            return ParaResult.err(ParaErrorCode.PARSE_ERROR,
                "Parsed YAML does not fit " + schema.getType().getSimpleName() + ": " + AppLogger.describe(e), e);
        }
    }
}
