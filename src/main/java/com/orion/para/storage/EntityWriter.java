package com.orion.para.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.orion.para.AppLogger;
import com.orion.para.ParaErrorCode;
import com.orion.para.ParaResult;
import com.orion.para.index.CategoryIndexRegistry;
import com.orion.para.index.CategoryIndexUpdater;
import com.orion.para.index.EntityType;
import com.orion.para.index.IndexFileCodec;
import com.orion.para.schema.EntitySchema;
import com.orion.para.schema.SchemaValidationException;
import com.orion.para.schema.ValidationResult;

import java.io.IOException;
import java.util.Optional;

/**
 * Atomic create/update and delete of entity files.
 *
 * Each write keeps the previous version as {@code <path>.bak} and reaches the
 * target through a single rename from {@code <path>.tmp}. The category index
 * is then synchronized on a best-effort basis: entity files are the source of
 * truth, so an index failure is logged and never undoes the write.
 */
public class EntityWriter {

    public static final String BACKUP_SUFFIX = ".bak";

    private final ParaFileSystem fileSystem;
    private final YamlCodec yaml;
    private final CategoryIndexUpdater indexUpdater;
    private final CategoryIndexRegistry registry;
    private final AtomicFileWriter atomicWriter;
    private final AppLogger logger = AppLogger.get();

    public EntityWriter(ParaFileSystem fileSystem, YamlCodec yaml, CategoryIndexUpdater indexUpdater) {
        this.fileSystem = fileSystem;
        this.yaml = yaml;
        this.indexUpdater = indexUpdater;
        this.registry = indexUpdater.getRegistry();
        this.atomicWriter = new AtomicFileWriter(fileSystem);
    }

    public static String backupPathFor(String path) {
        return path + BACKUP_SUFFIX;
    }

    public <T> ParaResult<Void> write(String path, T entity, EntitySchema<T> schema) {
        return write(path, entity, schema, WriteOptions.defaults());
    }

    public <T> ParaResult<Void> write(String path, T entity, EntitySchema<T> schema, WriteOptions options) {
        JsonNode tree = null;

        // 1. Validate
        if (options.isValidate()) {
            try {
                tree = yaml.toTree(entity);
            } catch (IllegalArgumentException e) {
                return ParaResult.err(ParaErrorCode.VALIDATION_ERROR,
                    "Validation failed: " + AppLogger.describe(e),
                    new SchemaValidationException(schema.getName(), AppLogger.describe(e), e));
            }
            ValidationResult validation = schema.validate(tree);
            if (!validation.isValid()) {
                return ParaResult.err(ParaErrorCode.VALIDATION_ERROR, "Validation failed: " + validation,
                    new SchemaValidationException(schema.getName(), validation));
            }
        }

        // 2. Existence decides whether there is anything to back up
        boolean exists;
        try {
            exists = fileSystem.exists(path);
        } catch (IOException | RuntimeException e) {
            return ParaResult.err(ParaErrorCode.FS_ERROR, "Failed to check file existence: " + AppLogger.describe(e), e);
        }

        // 3. Backup the prior version
        if (options.isCreateBackup() && exists) {
            try {
                fileSystem.copy(path, backupPathFor(path));
            } catch (IOException | RuntimeException e) {
                return ParaResult.err(ParaErrorCode.BACKUP_ERROR, "Failed to create backup: " + AppLogger.describe(e), e);
            }
        }

        // 4 + 5. Serialize, write to .tmp, rename into place
        String content;
        try {
            if (tree == null) {
                tree = yaml.toTree(entity);
            }
            if (tree == null || tree.isNull()) {
                return ParaResult.err(ParaErrorCode.WRITE_ERROR, "Failed to write file: entity is null");
            }
            content = yaml.stringify(tree);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return ParaResult.err(ParaErrorCode.WRITE_ERROR, "Failed to serialize entity: " + AppLogger.describe(e), e);
        }
        try {
            atomicWriter.write(path, content);
        } catch (AtomicWriteException e) {
            ParaErrorCode code = e.getStage() == AtomicWriteException.Stage.RENAME
                ? ParaErrorCode.RENAME_ERROR
                : ParaErrorCode.WRITE_ERROR;
            String what = code == ParaErrorCode.RENAME_ERROR ? "Failed to rename temp file: " : "Failed to write file: ";
            return ParaResult.err(code, what + AppLogger.describe(e.getCause()), e.getCause());
        }

        logger.info("Wrote entity " + path + (exists ? " (updated)" : " (created)"));

        // 6. Index, best-effort
        if (options.isUpdateIndex()) {
            Optional<EntityType> type = indexedTypeOf(path);
            if (type.isPresent()) {
                try {
                    indexUpdater.upsert(type.get(), tree);
                } catch (IOException | RuntimeException e) {
                    logger.warn("Index update skipped for " + path, e);
                }
            }
        }

        return ParaResult.ok();
    }

    public ParaResult<Void> delete(String path) {
        return delete(path, DeleteOptions.defaults());
    }

    public ParaResult<Void> delete(String path, DeleteOptions options) {
        // 1. Existence
        try {
            if (!fileSystem.exists(path)) {
                return ParaResult.err(ParaErrorCode.NOT_FOUND, "File not found: ~/" + path);
            }
        } catch (IOException | RuntimeException e) {
            return ParaResult.err(ParaErrorCode.FS_ERROR, "Failed to check file: " + AppLogger.describe(e), e);
        }

        // 2. Capture the id while the file is still there
        String entityId = null;
        if (options.isRemoveFromIndex()) {
            entityId = readEntityId(path);
        }

        // 3. Backup
        if (options.isCreateBackup()) {
            try {
                fileSystem.copy(path, backupPathFor(path));
            } catch (IOException | RuntimeException e) {
                return ParaResult.err(ParaErrorCode.BACKUP_ERROR, "Failed to create backup: " + AppLogger.describe(e), e);
            }
        }

        // 4. Remove
        try {
            fileSystem.remove(path);
        } catch (IOException | RuntimeException e) {
            return ParaResult.err(ParaErrorCode.DELETE_ERROR, "Failed to delete file: " + AppLogger.describe(e), e);
        }

        logger.info("Deleted entity " + path);

        // 5. Index, best-effort
        if (options.isRemoveFromIndex() && entityId != null) {
            Optional<EntityType> type = indexedTypeOf(path);
            if (type.isPresent()) {
                try {
                    indexUpdater.remove(type.get(), entityId);
                } catch (IOException | RuntimeException e) {
                    logger.warn("Index removal skipped for " + path, e);
                }
            }
        }

        return ParaResult.ok();
    }

    // Index files and the archive tree are not synchronized here.
    private Optional<EntityType> indexedTypeOf(String path) {
        if (registry.isIndexFile(path)) {
            return Optional.empty();
        }
        return registry.typeOf(path).filter(EntityType::isWriterIndexed);
    }

    private String readEntityId(String path) {
        try {
            return IndexFileCodec.idOf(yaml.parse(fileSystem.readString(path)));
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not read id from " + path + ", index entry left in place", e);
            return null;
        }
    }
}
