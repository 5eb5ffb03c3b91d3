package com.orion.para.storage;

import com.orion.para.AppLogger;

import java.io.IOException;

/**
 * Temp-then-rename writer. The target is only ever reached through one rename,
 * and the {@code .tmp} sibling is removed on every failure path.
 */
public final class AtomicFileWriter {

    public static final String TMP_SUFFIX = ".tmp";

    private final ParaFileSystem fileSystem;
    private final AppLogger logger = AppLogger.get();

    public AtomicFileWriter(ParaFileSystem fileSystem) {
        this.fileSystem = fileSystem;
    }

    public static String tmpPathFor(String path) {
        return path + TMP_SUFFIX;
    }

    public void write(String path, String content) throws AtomicWriteException {
        String tmpPath = tmpPathFor(path);
        try {
            fileSystem.writeString(tmpPath, content);
        } catch (IOException | RuntimeException e) {
            AtomicWriteException failure = new AtomicWriteException(AtomicWriteException.Stage.WRITE,
                "Failed to write " + tmpPath + ": " + AppLogger.describe(e), e);
            discardTmp(tmpPath, failure);
            throw failure;
        }
        try {
            fileSystem.rename(tmpPath, path);
        } catch (IOException | RuntimeException e) {
            AtomicWriteException failure = new AtomicWriteException(AtomicWriteException.Stage.RENAME,
                "Failed to rename " + tmpPath + " to " + path + ": " + AppLogger.describe(e), e);
            discardTmp(tmpPath, failure);
            throw failure;
        }
    }

    private void discardTmp(String tmpPath, AtomicWriteException failure) {
        try {
            if (fileSystem.exists(tmpPath)) {
                fileSystem.remove(tmpPath);
            }
        } catch (IOException | RuntimeException cleanup) {
            failure.addSuppressed(cleanup);
            logger.warn("Could not remove temp file " + tmpPath, cleanup);
        }
    }
}
