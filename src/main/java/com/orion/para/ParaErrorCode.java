package com.orion.para;

/**
 * Closed set of failure codes reported by the store.
 */
public enum ParaErrorCode {
    NOT_PARA_PATH,
    INVALID_CATEGORY,
    NOT_FOUND,
    READ_ERROR,
    PARSE_ERROR,
    VALIDATION_ERROR,
    WRITE_ERROR,
    RENAME_ERROR,
    BACKUP_ERROR,
    DELETE_ERROR,
    FS_ERROR,
    NOT_ARCHIVABLE,
    ALREADY_ARCHIVED
}
