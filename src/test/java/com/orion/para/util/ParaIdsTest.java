package com.orion.para.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ParaIdsTest {

    @Test
    void generatesPrefixedLowercaseIds() {
        String id = ParaIds.projectId();
        assertTrue(id.matches("proj_[0-9a-z]{12}"), id);
        assertTrue(ParaIds.hasPrefix(id, ParaIds.PROJECT));
        assertFalse(ParaIds.hasPrefix(id, ParaIds.AREA));
        assertTrue(ParaIds.hasPrefix(ParaIds.inboxId(), ParaIds.INBOX));
        assertTrue(ParaIds.contactId().startsWith("cont_"));
    }

    @Test
    void rejectsMalformedIds() {
        assertFalse(ParaIds.hasPrefix("proj_SHORT", ParaIds.PROJECT));
        assertFalse(ParaIds.hasPrefix("proj_ABCDEFGHIJKL", ParaIds.PROJECT));
        assertFalse(ParaIds.hasPrefix(null, ParaIds.PROJECT));
    }

    @Test
    void idsDoNotRepeat() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(ParaIds.areaId());
        }
        assertEquals(1000, ids.size());
    }
}
