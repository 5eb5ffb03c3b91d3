package com.orion.para.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * {@link ParaFileSystem} backed by the local disk, scoped to a base directory.
 */
public class LocalParaFileSystem implements ParaFileSystem {

    private final Path baseDirectory;

    public LocalParaFileSystem(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    /**
     * Map a namespace-relative path to a location under the base directory.
     */
    public Path toLocalPath(String path) throws IOException {
        if (path == null || path.isBlank()) {
            throw new IOException("path required");
        }
        Path resolved = baseDirectory.resolve(path).normalize();
        if (!resolved.startsWith(baseDirectory)) {
            throw new IOException("Path escapes base directory: " + path);
        }
        return resolved;
    }

    @Override
    public boolean exists(String path) throws IOException {
        return Files.exists(toLocalPath(path));
    }

    @Override
    public String readString(String path) throws IOException {
        return Files.readString(toLocalPath(path), StandardCharsets.UTF_8);
    }

    @Override
    public void writeString(String path, String content) throws IOException {
        Files.writeString(toLocalPath(path), content == null ? "" : content, StandardCharsets.UTF_8);
    }

    @Override
    public void copy(String from, String to) throws IOException {
        Files.copy(toLocalPath(from), toLocalPath(to), StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    public void rename(String from, String to) throws IOException {
        Path source = toLocalPath(from);
        Path target = toLocalPath(to);
        if (Files.isDirectory(source)) {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } else {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
    }

    @Override
    public void remove(String path) throws IOException {
        Files.delete(toLocalPath(path));
    }

    @Override
    public void createDirectories(String path) throws IOException {
        Files.createDirectories(toLocalPath(path));
    }
}
