package com.orion.para.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.orion.para.ParaErrorCode;
import com.orion.para.ParaResult;
import com.orion.para.index.CategoryIndexRegistry;
import com.orion.para.index.CategoryIndexUpdater;
import com.orion.para.index.IndexFileCodec;
import com.orion.para.models.ContactCard;
import com.orion.para.models.ProjectMeta;
import com.orion.para.schema.SchemaValidationException;
import com.orion.para.schema.Schemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityWriterTest {

    private static final String META = "Orion/Projects/q1/_meta.yaml";
    private static final String PROJECT_INDEX = "Orion/Projects/_index.yaml";

    @TempDir
    Path baseDir;

    private FaultInjectingFileSystem fs;
    private YamlCodec yaml;
    private EntityWriter writer;
    private EntityReader reader;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(baseDir.resolve("Orion/Projects/q1"));
        Files.createDirectories(baseDir.resolve("Orion/Resources/contacts"));
        fs = new FaultInjectingFileSystem(baseDir);
        yaml = new YamlCodec();
        Clock clock = Clock.fixed(Instant.parse("2026-01-27T10:00:00Z"), ZoneOffset.UTC);
        CategoryIndexUpdater updater = new CategoryIndexUpdater(fs, new CategoryIndexRegistry("Orion"),
            new IndexFileCodec(yaml), clock);
        writer = new EntityWriter(fs, yaml, updater);
        reader = new EntityReader(fs, yaml);
    }

    private static ProjectMeta project(String status) {
        ProjectMeta project = new ProjectMeta("proj_q1", "Q1 Launch", status);
        project.setPriority("high");
        project.setCreatedAt("2026-01-01T09:00:00Z");
        project.setUpdatedAt("2026-01-20T09:00:00Z");
        return project;
    }

    private String readFile(String path) throws Exception {
        return Files.readString(baseDir.resolve(path), StandardCharsets.UTF_8);
    }

    private JsonNode readIndex(String path) throws Exception {
        return yaml.parse(readFile(path));
    }

    @Test
    void createsEntityReadableThroughSchema() {
        assertTrue(writer.write(META, project("active"), Schemas.PROJECT).isOk());

        ParaResult<ProjectMeta> read = reader.read(META, Schemas.PROJECT);
        assertTrue(read.isOk());
        assertEquals("Q1 Launch", read.getValue().getName());
        assertEquals("high", read.getValue().getPriority());
    }

    @Test
    void numberLikeStringsSurviveWriteAndRead() throws Exception {
        List<String> names = List.of(".inf", "-.Inf", ".nan", "0x1F", "0o17", "0b101", "1e3", "1_000", "12",
            "true", "no", "null", "~", "2026-01-01");
        for (int i = 0; i < names.size(); i++) {
            String path = "Orion/Projects/v" + i + "/_meta.yaml";
            Files.createDirectories(baseDir.resolve("Orion/Projects/v" + i));
            ProjectMeta project = project("active");
            project.setId("proj_v" + i);
            project.setName(names.get(i));

            assertTrue(writer.write(path, project, Schemas.PROJECT).isOk());
            ParaResult<ProjectMeta> read = reader.read(path, Schemas.PROJECT);
            assertTrue(read.isOk(), names.get(i) + ": " + read);
            assertEquals(names.get(i), read.getValue().getName());
        }

        JsonNode entries = readIndex(PROJECT_INDEX).path("projects");
        assertEquals(names.size(), entries.size());
        for (int i = 0; i < names.size(); i++) {
            assertTrue(entries.get(i).path("name").isTextual());
            assertEquals(names.get(i), entries.get(i).path("name").asText());
        }
    }

    @Test
    void firstWriteLeavesNoBackupOrTempFile() {
        writer.write(META, project("active"), Schemas.PROJECT);
        assertFalse(Files.exists(baseDir.resolve(META + ".bak")));
        assertFalse(Files.exists(baseDir.resolve(META + ".tmp")));
    }

    @Test
    void overwriteKeepsPreviousVersionAsBackup() throws Exception {
        writer.write(META, project("active"), Schemas.PROJECT);
        String first = readFile(META);

        assertTrue(writer.write(META, project("paused"), Schemas.PROJECT).isOk());
        assertEquals(first, readFile(META + ".bak"));
        assertTrue(readFile(META).contains("paused"));
    }

    @Test
    void backupCanBeSkipped() {
        writer.write(META, project("active"), Schemas.PROJECT);
        writer.write(META, project("paused"), Schemas.PROJECT, WriteOptions.defaults().createBackup(false));
        assertFalse(Files.exists(baseDir.resolve(META + ".bak")));
    }

    @Test
    void invalidEntityIsRejectedBeforeAnyMutation() {
        ParaResult<Void> result = writer.write(META, project("finished"), Schemas.PROJECT);
        assertEquals(ParaErrorCode.VALIDATION_ERROR, result.getErrorCode());
        assertTrue(result.getError().getCause() instanceof SchemaValidationException);
        assertTrue(result.getError().getMessage().contains("status:invalid"));
        assertTrue(fs.getMutations().isEmpty());
    }

    @Test
    void renameFailureLeavesPriorContentIntact() throws Exception {
        writer.write(META, project("active"), Schemas.PROJECT);
        String before = readFile(META);

        fs.failOn(FaultInjectingFileSystem.Op.RENAME, META + ".tmp");
        ParaResult<Void> result = writer.write(META, project("completed"), Schemas.PROJECT);

        assertEquals(ParaErrorCode.RENAME_ERROR, result.getErrorCode());
        assertEquals(before, readFile(META));
        assertFalse(Files.exists(baseDir.resolve(META + ".tmp")));
    }

    @Test
    void tempWriteFailureLeavesTargetAbsent() {
        fs.failOn(FaultInjectingFileSystem.Op.WRITE, META + ".tmp");
        ParaResult<Void> result = writer.write(META, project("active"), Schemas.PROJECT);

        assertEquals(ParaErrorCode.WRITE_ERROR, result.getErrorCode());
        assertFalse(Files.exists(baseDir.resolve(META)));
        assertFalse(Files.exists(baseDir.resolve(META + ".tmp")));
    }

    @Test
    void backupFailureStopsTheWrite() throws Exception {
        writer.write(META, project("active"), Schemas.PROJECT);
        fs.failOn(FaultInjectingFileSystem.Op.COPY, META);

        ParaResult<Void> result = writer.write(META, project("paused"), Schemas.PROJECT);
        assertEquals(ParaErrorCode.BACKUP_ERROR, result.getErrorCode());
        assertTrue(readFile(META).contains("active"));
    }

    @Test
    void writeUpsertsCategoryIndexById() throws Exception {
        writer.write(META, project("active"), Schemas.PROJECT);
        writer.write(META, project("paused"), Schemas.PROJECT);

        JsonNode index = readIndex(PROJECT_INDEX);
        assertEquals(1, index.path("projects").size());
        assertEquals("proj_q1", index.path("projects").get(0).path("id").asText());
        assertEquals("paused", index.path("projects").get(0).path("status").asText());
        assertEquals("2026-01-27T10:00:00Z", index.path("updated_at").asText());
    }

    @Test
    void indexCanBeSkipped() {
        writer.write(META, project("active"), Schemas.PROJECT, WriteOptions.defaults().updateIndex(false));
        assertFalse(Files.exists(baseDir.resolve(PROJECT_INDEX)));
    }

    @Test
    void indexFailureDoesNotFailTheWrite() throws Exception {
        fs.failOn(FaultInjectingFileSystem.Op.WRITE, PROJECT_INDEX + ".tmp");

        assertTrue(writer.write(META, project("active"), Schemas.PROJECT).isOk());
        assertTrue(readFile(META).contains("proj_q1"));
        assertFalse(Files.exists(baseDir.resolve(PROJECT_INDEX)));
    }

    @Test
    void corruptIndexDoesNotFailTheWrite() throws Exception {
        Files.writeString(baseDir.resolve(PROJECT_INDEX), "- not\n- a mapping\n");
        assertTrue(writer.write(META, project("active"), Schemas.PROJECT).isOk());
        assertEquals("- not\n- a mapping\n", readFile(PROJECT_INDEX));
    }

    @Test
    void resourceEntitiesGoToTheirSubcategoryIndex() throws Exception {
        ContactCard contact = new ContactCard("cont_ana", "Ana", "person");
        contact.setCreatedAt("2026-01-01T00:00:00Z");
        contact.setUpdatedAt("2026-01-01T00:00:00Z");

        assertTrue(writer.write("Orion/Resources/contacts/ana.yaml", contact, Schemas.CONTACT).isOk());
        JsonNode index = readIndex("Orion/Resources/contacts/_index.yaml");
        assertEquals("cont_ana", index.path("contacts").get(0).path("id").asText());
    }

    @Test
    void deleteRemovesFileKeepsBackupAndUpdatesIndex() throws Exception {
        writer.write(META, project("active"), Schemas.PROJECT);
        String content = readFile(META);

        assertTrue(writer.delete(META).isOk());
        assertFalse(Files.exists(baseDir.resolve(META)));
        assertEquals(content, readFile(META + ".bak"));
        assertEquals(0, readIndex(PROJECT_INDEX).path("projects").size());
    }

    @Test
    void deleteWithoutIndexRemovalLeavesEntry() throws Exception {
        writer.write(META, project("active"), Schemas.PROJECT);
        writer.delete(META, DeleteOptions.defaults().removeFromIndex(false).createBackup(false));

        assertFalse(Files.exists(baseDir.resolve(META + ".bak")));
        assertEquals(1, readIndex(PROJECT_INDEX).path("projects").size());
    }

    @Test
    void deleteOfMissingFileIsNotFound() {
        ParaResult<Void> result = writer.delete("Orion/Projects/q1/missing.yaml");
        assertEquals(ParaErrorCode.NOT_FOUND, result.getErrorCode());
        assertEquals("File not found: ~/Orion/Projects/q1/missing.yaml", result.getError().getMessage());
    }

    @Test
    void deleteFailureKeepsFile() {
        writer.write(META, project("active"), Schemas.PROJECT);
        fs.failOn(FaultInjectingFileSystem.Op.REMOVE, META);

        assertEquals(ParaErrorCode.DELETE_ERROR, writer.delete(META).getErrorCode());
        assertTrue(Files.exists(baseDir.resolve(META)));
    }
}
