package com.orion.para;

import com.orion.para.archive.ArchivalEngine;
import com.orion.para.archive.ArchiveException;
import com.orion.para.archive.ArchiveIndexStore;
import com.orion.para.archive.ArchiveResult;
import com.orion.para.index.CategoryIndexRegistry;
import com.orion.para.index.CategoryIndexUpdater;
import com.orion.para.index.IndexFileCodec;
import com.orion.para.models.ArchiveIndex;
import com.orion.para.models.AreaMeta;
import com.orion.para.models.ProjectMeta;
import com.orion.para.paths.ParaPathResolver;
import com.orion.para.schema.EntitySchema;
import com.orion.para.storage.DeleteOptions;
import com.orion.para.storage.EntityReader;
import com.orion.para.storage.EntityWriter;
import com.orion.para.storage.LocalParaFileSystem;
import com.orion.para.storage.ParaFileSystem;
import com.orion.para.storage.ReadOptions;
import com.orion.para.storage.WriteOptions;
import com.orion.para.storage.YamlCodec;

import java.io.IOException;
import java.time.Clock;

/**
 * Entry point to the PARA entity store: path resolution, entity read/write/delete
 * and archival, wired over one filesystem and one namespace root.
 *
 * Paths passed to {@link #read}, {@link #write} and {@link #delete} are physical,
 * namespace-relative paths as returned by {@link #resolve}.
 */
public class ParaStore {

    private final ParaPathResolver resolver;
    private final CategoryIndexRegistry registry;
    private final EntityReader reader;
    private final EntityWriter writer;
    private final ArchiveIndexStore archiveIndexStore;
    private final ArchivalEngine archivalEngine;

    public ParaStore(ParaFileSystem fileSystem, String rootName, String scheme, Clock clock) {
        YamlCodec yaml = new YamlCodec();
        IndexFileCodec indexCodec = new IndexFileCodec(yaml);
        this.resolver = new ParaPathResolver(rootName, scheme);
        this.registry = new CategoryIndexRegistry(rootName);
        CategoryIndexUpdater indexUpdater = new CategoryIndexUpdater(fileSystem, registry, indexCodec, clock);
        this.reader = new EntityReader(fileSystem, yaml);
        this.writer = new EntityWriter(fileSystem, yaml, indexUpdater);
        this.archiveIndexStore = new ArchiveIndexStore(fileSystem, registry, indexCodec, reader, clock);
        this.archivalEngine = new ArchivalEngine(fileSystem, rootName, archiveIndexStore, indexUpdater, clock);
    }

    /**
     * Open a store on the local disk as described by {@code config}, initializing file logging.
     */
    public static ParaStore open(AppConfig config) throws IOException {
        AppLogger.initialize(config.getLogPath(), config.isConsoleLog());
        AppLogger.get().info("Opening PARA store at " + config.getRootPath());
        return new ParaStore(new LocalParaFileSystem(config.getBaseDirectory()),
            config.getRootName(), config.getScheme(), Clock.systemUTC());
    }

    public ParaPathResolver getResolver() {
        return resolver;
    }

    public CategoryIndexRegistry getRegistry() {
        return registry;
    }

    public ParaResult<String> resolve(String address) {
        return resolver.resolve(address);
    }

    public ParaResult<String> toLogicalAddress(String physicalPath) {
        return resolver.toLogicalAddress(physicalPath);
    }

    public <T> ParaResult<T> read(String path, EntitySchema<T> schema) {
        return reader.read(path, schema);
    }

    public <T> ParaResult<T> read(String path, EntitySchema<T> schema, ReadOptions options) {
        return reader.read(path, schema, options);
    }

    public <T> ParaResult<Void> write(String path, T entity, EntitySchema<T> schema) {
        return writer.write(path, entity, schema);
    }

    public <T> ParaResult<Void> write(String path, T entity, EntitySchema<T> schema, WriteOptions options) {
        return writer.write(path, entity, schema, options);
    }

    public ParaResult<Void> delete(String path) {
        return writer.delete(path);
    }

    public ParaResult<Void> delete(String path, DeleteOptions options) {
        return writer.delete(path, options);
    }

    public ArchiveResult archiveProject(ProjectMeta project, String originalPath) throws ArchiveException {
        return archivalEngine.archiveProject(project, originalPath);
    }

    public ArchiveResult archiveArea(AreaMeta area, String originalPath) throws ArchiveException {
        return archivalEngine.archiveArea(area, originalPath);
    }

    public ParaResult<ArchiveIndex> loadArchiveIndex() {
        return archiveIndexStore.load();
    }
}
