// file: storage/src/test/java/io/envsync/storage/CatalogCodecTest.java
package io.envsync.storage;

import io.envsync.core.AssignmentSpec;
import io.envsync.core.CatalogException;
import io.envsync.core.DefaultCatalog;
import io.envsync.core.ResourceCatalog;
import io.envsync.core.ResourceDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CatalogCodecTest {

    @TempDir Path dir;

    @Test
    void default_catalog_survives_save_and_load() {
        Path file = dir.resolve("catalog.json");
        ResourceCatalog original = DefaultCatalog.create();

        CatalogCodec.save(original, file);
        ResourceCatalog loaded = CatalogCodec.load(file);

        assertEquals(original.all(), loaded.all());
    }

    @Test
    void assignment_survives_save_and_load() {
        Path file = dir.resolve("catalog.json");
        ResourceCatalog original = new ResourceCatalog(List.of(
                ResourceDescriptor.independent("group", "lists"),
                ResourceDescriptor.independent("user", "lists"),
                ResourceDescriptor.dependent("group", "listUsers", "group", "groupId")
                        .withAssignment(new AssignmentSpec("user", "userId", "group", "addUserToGroup"))));

        CatalogCodec.save(original, file);
        ResourceCatalog loaded = CatalogCodec.load(file);

        assertEquals(original.all(), loaded.all());
        assertTrue(loaded.dependentResources().get(0).isAssignment());
    }

    @Test
    void hand_written_catalog_gets_default_source_parameter() throws Exception {
        Path file = dir.resolve("catalog.json");
        Files.writeString(file, """
                {
                  "singletonResources": [ {"name": "orgSetting", "getCommand": "gets"} ],
                  "firstPassResources": [ {"name": "group", "listCommand": "lists"} ],
                  "secondPassResources": [
                    {"name": "groupMembers", "listCommand": "listUsers", "sourceType": "group"}
                  ]
                }
                """);

        ResourceCatalog catalog = CatalogCodec.load(file);

        ResourceDescriptor members = catalog.dependentResources().get(0);
        assertEquals("group", members.sourceType());
        assertEquals("groupId", members.sourceParameter());
        assertEquals(1, catalog.singletonResources().size());
    }

    @Test
    void catalog_with_dangling_source_is_rejected() throws Exception {
        Path file = dir.resolve("catalog.json");
        Files.writeString(file, """
                {
                  "firstPassResources": [ {"name": "group", "listCommand": "lists"} ],
                  "secondPassResources": [
                    {"name": "policy", "listCommand": "listRules", "sourceType": "policy"}
                  ]
                }
                """);

        assertThrows(CatalogException.class, () -> CatalogCodec.load(file));
    }

    @Test
    void entry_without_command_is_rejected() throws Exception {
        Path file = dir.resolve("catalog.json");
        Files.writeString(file, """
                { "firstPassResources": [ {"name": "group"} ] }
                """);

        assertThrows(CatalogException.class, () -> CatalogCodec.load(file));
    }

    @Test
    void unreadable_catalog_is_a_persistence_error() throws Exception {
        Path file = dir.resolve("catalog.json");
        Files.writeString(file, "{ broken");

        assertThrows(PersistenceException.class, () -> CatalogCodec.load(file));
        assertThrows(PersistenceException.class, () -> CatalogCodec.load(dir.resolve("absent.json")));
    }
}
