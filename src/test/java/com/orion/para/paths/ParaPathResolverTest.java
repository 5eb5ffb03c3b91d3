package com.orion.para.paths;

import com.orion.para.ParaErrorCode;
import com.orion.para.ParaResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParaPathResolverTest {

    private final ParaPathResolver resolver = new ParaPathResolver();

    @Test
    void resolvesSchemeUri() {
        assertEquals("Orion/Projects/q1", resolver.resolve("para://projects/q1").getValue());
        assertEquals("Orion/Areas/health/_meta.yaml", resolver.resolve("para://areas/health/_meta.yaml").getValue());
    }

    @Test
    void schemeAndCategoryAreCaseInsensitive() {
        assertEquals("Orion/Projects/q1", resolver.resolve("PARA://Projects/q1").getValue());
        assertEquals("Orion/Inbox", resolver.resolve("para://INBOX").getValue());
    }

    @Test
    void resolvesNamespaceRootedPath() {
        assertEquals("Orion/Projects/q1", resolver.resolve("Orion/Projects/q1").getValue());
        assertEquals("Orion/Projects/q1", resolver.resolve("Orion/projects/q1").getValue());
        assertEquals("Orion", resolver.resolve("Orion").getValue());
        assertEquals("Orion", resolver.resolve("Orion/").getValue());
    }

    @Test
    void resolvesBareCategoryPath() {
        assertEquals("Orion/Projects/q1", resolver.resolve("projects/q1").getValue());
        assertEquals("Orion/Resources/contacts/john.yaml", resolver.resolve("contacts/john").getValue());
    }

    @Test
    void appendsExtensionOnceForEntityCategories() {
        String bare = resolver.resolve("para://contacts/john").getValue();
        String withExt = resolver.resolve("para://contacts/john.yaml").getValue();
        assertEquals("Orion/Resources/contacts/john.yaml", bare);
        assertEquals(bare, withExt);
        assertFalse(bare.contains(".yaml.yaml"));

        assertEquals("Orion/Resources/notes/ideas/today.yaml", resolver.resolve("para://notes/ideas/today").getValue());
        assertEquals("Orion/Resources/templates", resolver.resolve("para://templates").getValue());
    }

    @Test
    void doesNotAppendExtensionForDirectoryCategories() {
        assertEquals("Orion/Projects/q1", resolver.resolve("para://projects/q1").getValue());
        assertEquals("Orion/Resources/contacts/john", resolver.resolve("para://resources/contacts/john").getValue());
    }

    @Test
    void normalizesRepeatedAndTrailingSeparators() {
        assertEquals("Orion/Projects/q1/docs", resolver.resolve("para://projects//q1///docs/").getValue());
        assertEquals("Orion/Projects/q1", resolver.resolve("para:///projects/q1").getValue());
        assertEquals("Orion/Projects/q1", resolver.resolve("Orion//Projects/q1/").getValue());
    }

    @Test
    void preservesSpacesDotsAndUnicode() {
        assertEquals("Orion/Projects/My Project.v2/ñotes ü",
            resolver.resolve("para://projects/My Project.v2/ñotes ü").getValue());
    }

    @Test
    void emptySchemeBodyResolvesToRoot() {
        assertEquals("Orion", resolver.resolve("para://").getValue());
        assertEquals("Orion", resolver.resolve("para:///").getValue());
    }

    @Test
    void unknownCategoryIsReportedWithValidList() {
        ParaResult<String> result = resolver.resolve("para://unknown/x");
        assertTrue(result.isErr());
        assertEquals(ParaErrorCode.INVALID_CATEGORY, result.getErrorCode());
        PathResolveError error = (PathResolveError) result.getError();
        assertEquals("unknown", error.getCategory());
        assertEquals(ParaCategory.names(), error.getValid());
        assertTrue(error.getValid().containsAll(List.of("projects", "contacts", "preferences")));
    }

    @Test
    void unknownRootedCategoryIsInvalid() {
        assertEquals(ParaErrorCode.INVALID_CATEGORY, resolver.resolve("Orion/Downloads/x").getErrorCode());
    }

    @Test
    void nonParaPathsAreRejected() {
        ParaResult<String> result = resolver.resolve("Documents/file.txt");
        assertEquals(ParaErrorCode.NOT_PARA_PATH, result.getErrorCode());
        assertEquals("Documents/file.txt", ((PathResolveError) result.getError()).getPath());
        assertEquals(ParaErrorCode.NOT_PARA_PATH, resolver.resolve("OrionExtra/file").getErrorCode());
        assertEquals(ParaErrorCode.NOT_PARA_PATH, resolver.resolve("").getErrorCode());
        assertEquals(ParaErrorCode.NOT_PARA_PATH, resolver.resolve(null).getErrorCode());
    }

    @Test
    void toLogicalAddressLowercasesCategory() {
        assertEquals("para://projects/q1", resolver.toLogicalAddress("Orion/Projects/q1").getValue());
        assertEquals("para://", resolver.toLogicalAddress("Orion").getValue());
        assertEquals("para://resources/contacts/john.yaml",
            resolver.toLogicalAddress("Orion/Resources/contacts/john.yaml").getValue());
        assertEquals(ParaErrorCode.NOT_PARA_PATH, resolver.toLogicalAddress("Documents/file").getErrorCode());
    }

    @Test
    void resolveInvertsToLogicalAddressForResolvedPaths() {
        List<String> addresses = List.of(
            "para://",
            "para://projects",
            "para://projects/q1/_meta.yaml",
            "para://areas/health",
            "para://archive/projects/2025-12/p1",
            "para://inbox/_queue.yaml",
            "para://resources",
            "para://contacts/john",
            "para://notes/sub dir/idea.yaml",
            "para://preferences/ui",
            "projects/My Project",
            "Orion/procedures/deploy"
        );
        for (String address : addresses) {
            String physical = resolver.resolve(address).getValue();
            String logical = resolver.toLogicalAddress(physical).getValue();
            assertEquals(physical, resolver.resolve(logical).getValue(), "round trip of " + address);
        }
    }

    @Test
    void honoursConfiguredRootAndScheme() {
        ParaPathResolver custom = new ParaPathResolver("Vault", "kb");
        assertEquals("Vault/Areas/home", custom.resolve("kb://areas/home").getValue());
        assertEquals("kb://areas/home", custom.toLogicalAddress("Vault/Areas/home").getValue());
        assertEquals(ParaErrorCode.NOT_PARA_PATH, custom.resolve("para://areas/home").getErrorCode());
    }

    @Test
    void categoryLookupIsCaseInsensitive() {
        ParaCategory contacts = ParaCategory.fromName("CONTACTS").orElseThrow();
        assertEquals("contacts", contacts.getLogicalName());
        assertEquals("Resources/contacts", contacts.getDirectory());
        assertTrue(contacts.hasEntityFiles());
        assertTrue(ParaCategory.fromName("downloads").isEmpty());
    }

    @Test
    void isParaPathRequiresExactRootSegment() {
        assertTrue(resolver.isParaPath("Orion"));
        assertTrue(resolver.isParaPath("Orion/Projects/q1"));
        assertFalse(resolver.isParaPath("OrionExtra/file"));
        assertFalse(resolver.isParaPath(""));
        assertEquals("Orion/Projects/q1", resolver.buildPath("Projects", "q1"));
    }
}
