package com.orion.para;

import com.fasterxml.jackson.databind.JsonNode;
import com.orion.para.archive.ArchiveResult;
import com.orion.para.index.EntityType;
import com.orion.para.models.ArchiveIndex;
import com.orion.para.models.ContactCard;
import com.orion.para.models.ProjectMeta;
import com.orion.para.schema.Schemas;
import com.orion.para.storage.LocalParaFileSystem;
import com.orion.para.storage.YamlCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ParaStoreTest {

    @TempDir
    Path baseDir;

    private ParaStore newStore() {
        return new ParaStore(new LocalParaFileSystem(baseDir), "Orion", "para",
            Clock.fixed(Instant.parse("2026-01-27T10:00:00Z"), ZoneOffset.UTC));
    }

    private JsonNode readYaml(String path) throws Exception {
        return new YamlCodec().parse(Files.readString(baseDir.resolve(path)));
    }

    @Test
    void projectLifecycleFromCreationToArchive() throws Exception {
        Files.createDirectories(baseDir.resolve("Orion/Projects/p1"));
        ParaStore store = newStore();

        String dir = store.resolve("para://projects/p1").getValue();
        String meta = dir + "/_meta.yaml";
        assertEquals("Orion/Projects/p1/_meta.yaml", meta);

        ProjectMeta project = new ProjectMeta("proj_1", "Pilot", "active");
        project.setPriority("high");
        project.setCreatedAt("2026-01-05T09:00:00Z");
        project.setUpdatedAt("2026-01-05T09:00:00Z");
        assertTrue(store.write(meta, project, Schemas.PROJECT).isOk());
        assertTrue(Files.exists(baseDir.resolve(meta)));
        assertEquals("proj_1", readYaml("Orion/Projects/_index.yaml").path("projects").get(0).path("id").asText());

        project.setStatus("completed");
        project.setUpdatedAt("2026-01-20T09:00:00Z");
        assertTrue(store.write(meta, project, Schemas.PROJECT).isOk());
        assertEquals("active", readYaml(meta + ".bak").path("status").asText());

        ArchiveResult result = store.archiveProject(project, "Projects/p1");
        assertEquals("Orion/Archive/projects/2026-01/p1", result.getArchivedTo());
        assertFalse(Files.exists(baseDir.resolve("Orion/Projects/p1")));
        assertTrue(Files.exists(baseDir.resolve("Orion/Archive/projects/2026-01/p1/_meta.yaml")));

        ArchiveIndex index = store.loadArchiveIndex().getValue();
        assertEquals(1, index.getArchivedItems().size());
        assertEquals("proj_1", index.getArchivedItems().get(0).getId());
        assertEquals("completed", index.getArchivedItems().get(0).getReason());
        assertEquals(1, index.getStats().getTotal());
        assertEquals(1, index.getStats().getProjects());
        assertEquals(0, index.getStats().getAreas());

        assertEquals("para://archive/projects/2026-01/p1",
            store.toLogicalAddress(result.getArchivedTo()).getValue());
    }

    @Test
    void contactRoundTripThroughLogicalAddress() throws Exception {
        Files.createDirectories(baseDir.resolve("Orion/Resources/contacts"));
        ParaStore store = newStore();

        String path = store.resolve("para://contacts/ana").getValue();
        ContactCard card = new ContactCard("cont_ana", "Ana", "person");
        card.setEmail("ana@example.org");
        card.setCreatedAt("2026-01-01T00:00:00Z");
        card.setUpdatedAt("2026-01-01T00:00:00Z");
        assertTrue(store.write(path, card, Schemas.CONTACT).isOk());

        ParaResult<ContactCard> read = store.read(path, Schemas.CONTACT);
        assertEquals("ana@example.org", read.getValue().getEmail());

        assertTrue(store.delete(path).isOk());
        assertEquals(ParaErrorCode.NOT_FOUND, store.read(path, Schemas.CONTACT).getErrorCode());
    }

    @Test
    void missingArchiveIndexIsNotFound() {
        assertEquals(ParaErrorCode.NOT_FOUND, newStore().loadArchiveIndex().getErrorCode());
    }

    @Test
    void opensFromConfiguration() throws Exception {
        AppConfig config = new AppConfig.Builder()
            .baseDirectory(baseDir)
            .rootName("Vault")
            .scheme("kb")
            .logPath(baseDir.resolve("logs/para.log").toString())
            .build();

        ParaStore store = ParaStore.open(config);
        assertEquals("Vault/Inbox/_queue.yaml", store.resolve("kb://inbox/_queue.yaml").getValue());
        assertEquals("Vault/Inbox/_queue.yaml", store.getRegistry().indexPathFor(EntityType.INBOX));
    }
}
