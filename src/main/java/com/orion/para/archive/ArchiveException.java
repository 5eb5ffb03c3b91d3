package com.orion.para.archive;

import com.orion.para.ParaErrorCode;

/**
 * Thrown by the archival engine. The code is one of NOT_ARCHIVABLE,
 * ALREADY_ARCHIVED, NOT_FOUND or FS_ERROR.
 */
public class ArchiveException extends Exception {
    private final ParaErrorCode code;

    public ArchiveException(ParaErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ArchiveException(ParaErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ParaErrorCode getCode() {
        return code;
    }
}
