package com.orion.para.archive;

import com.orion.para.ParaResult;
import com.orion.para.index.CategoryIndexRegistry;
import com.orion.para.index.IndexFileCodec;
import com.orion.para.models.ArchiveIndex;
import com.orion.para.schema.Schemas;
import com.orion.para.storage.AtomicFileWriter;
import com.orion.para.storage.EntityReader;
import com.orion.para.storage.ParaFileSystem;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;

/**
 * Access to the archive-wide index, {@code Archive/_index.yaml}.
 */
public class ArchiveIndexStore {

    private final ParaFileSystem fileSystem;
    private final String indexPath;
    private final IndexFileCodec codec;
    private final EntityReader reader;
    private final AtomicFileWriter writer;
    private final Clock clock;

    public ArchiveIndexStore(ParaFileSystem fileSystem, CategoryIndexRegistry registry, IndexFileCodec codec,
                             EntityReader reader, Clock clock) {
        this.fileSystem = fileSystem;
        this.indexPath = registry.archiveIndexPath();
        this.codec = codec;
        this.reader = reader;
        this.writer = new AtomicFileWriter(fileSystem);
        this.clock = clock;
    }

    public String getIndexPath() {
        return indexPath;
    }

    public ArchiveIndex defaultIndex() {
        ArchiveIndex index = new ArchiveIndex();
        index.setVersion(IndexFileCodec.INDEX_VERSION);
        index.setGeneratedAt(Instant.now(clock).toString());
        return index;
    }

    /**
     * Load and validate the archive index.
     */
    public ParaResult<ArchiveIndex> load() {
        return reader.read(indexPath, Schemas.ARCHIVE_INDEX);
    }

    /**
     * Index to append to: the stored one, or a default when none exists yet.
     * An unreadable index is an error rather than a reset, so archive history
     * is never overwritten with an empty document.
     */
    ArchiveIndex readForUpdate() throws IOException {
        if (!fileSystem.exists(indexPath)) {
            return defaultIndex();
        }
        String content = fileSystem.readString(indexPath);
        if (content == null || content.isBlank()) {
            return defaultIndex();
        }
        return codec.parseArchiveIndex(content);
    }

    void write(ArchiveIndex index) throws IOException {
        writer.write(indexPath, codec.serializeArchiveIndex(index));
    }
}
