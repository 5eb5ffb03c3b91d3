package com.orion.para.storage;

import java.io.IOException;

/**
 * Filesystem capability the store runs against. Paths are namespace-relative
 * strings such as {@code Orion/Projects/q1/_meta.yaml}, resolved by the
 * implementation against its base directory.
 */
public interface ParaFileSystem {

    boolean exists(String path) throws IOException;

    String readString(String path) throws IOException;

    /**
     * Create or truncate {@code path} and write {@code content} as UTF-8.
     * Missing parent directories are not created.
     */
    void writeString(String path, String content) throws IOException;

    /**
     * Copy a file, replacing any existing target.
     */
    void copy(String from, String to) throws IOException;

    /**
     * Atomically rename a file or directory. An existing target file is replaced.
     */
    void rename(String from, String to) throws IOException;

    void remove(String path) throws IOException;

    /**
     * Create a directory and any missing parents.
     */
    void createDirectories(String path) throws IOException;
}
