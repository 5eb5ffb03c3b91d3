package com.orion.para.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.orion.para.models.ArchiveIndex;
import com.orion.para.models.ArchivedItem;
import com.orion.para.models.AreaMeta;
import com.orion.para.models.ContactCard;
import com.orion.para.models.InboxItem;
import com.orion.para.models.ProjectMeta;

public final class Schemas {
    public static final EntitySchema<ProjectMeta> PROJECT = new ProjectMetaSchema();
    public static final EntitySchema<AreaMeta> AREA = new AreaMetaSchema();
    public static final EntitySchema<ContactCard> CONTACT = new ContactCardSchema();
    public static final EntitySchema<InboxItem> INBOX_ITEM = new InboxItemSchema();
    public static final EntitySchema<ArchivedItem> ARCHIVED_ITEM = new ArchivedItemSchema();
    public static final EntitySchema<ArchiveIndex> ARCHIVE_INDEX = new ArchiveIndexSchema();
    public static final EntitySchema<JsonNode> RAW = new RawEntitySchema();

    private Schemas() {
    }
}
