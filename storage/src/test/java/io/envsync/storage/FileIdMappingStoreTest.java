// file: storage/src/test/java/io/envsync/storage/FileIdMappingStoreTest.java
package io.envsync.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileIdMappingStoreTest {

    @TempDir Path dir;

    @Test
    void missing_file_loads_as_empty_store() {
        Path file = dir.resolve("id_mapping.json");

        FileIdMappingStore store = FileIdMappingStore.load(file);

        assertEquals(Map.of(), store.snapshot());
        assertEquals(Optional.empty(), store.getNewId("group", "g1"));
        assertFalse(Files.exists(file), "loading must not create the file");
    }

    @Test
    void every_mapping_is_persisted_immediately() {
        Path file = dir.resolve("id_mapping.json");
        FileIdMappingStore store = FileIdMappingStore.load(file);

        store.addMapping("group", "g1", "newG1");

        // "Crash": drop the instance, reload from disk
        FileIdMappingStore reloaded = FileIdMappingStore.load(file);
        assertEquals(Optional.of("newG1"), reloaded.getNewId("group", "g1"));
        assertEquals(1, reloaded.size("group"));
        assertFalse(Files.exists(dir.resolve("id_mapping.json.tmp")));
    }

    @Test
    void lookup_misses_on_unknown_type_or_id() {
        FileIdMappingStore store = FileIdMappingStore.empty(dir.resolve("m.json"));
        store.addMapping("group", "g1", "newG1");

        assertTrue(store.getNewId("user", "g1").isEmpty());
        assertTrue(store.getNewId("group", "g2").isEmpty());
        assertEquals(0, store.size("user"));
    }

    @Test
    void add_overwrites_previous_mapping() {
        FileIdMappingStore store = FileIdMappingStore.empty(dir.resolve("m.json"));
        store.addMapping("group", "g1", "first");
        store.addMapping("group", "g1", "second");

        assertEquals(Optional.of("second"), store.getNewId("group", "g1"));
        assertEquals(1, store.size("group"));
    }

    @Test
    void load_then_save_reproduces_content() throws Exception {
        Path file = dir.resolve("id_mapping.json");
        FileIdMappingStore original = FileIdMappingStore.empty(file);
        original.addMapping("user", "u1", "newU1");
        original.addMapping("group", "g2", "newG2");
        original.addMapping("group", "g1", "newG1");
        String before = Files.readString(file);

        FileIdMappingStore reloaded = FileIdMappingStore.load(file);
        reloaded.save();

        assertEquals(before, Files.readString(file));
        assertEquals(original.snapshot(), reloaded.snapshot());
    }

    @Test
    void hand_written_file_is_accepted() throws Exception {
        Path file = dir.resolve("id_mapping.json");
        Files.writeString(file, """
                {"group": {"g1": "newG1"}, "user": {}}
                """);

        FileIdMappingStore store = FileIdMappingStore.load(file);

        assertEquals(Optional.of("newG1"), store.getNewId("group", "g1"));
        assertEquals(0, store.size("user"));
    }

    @Test
    void malformed_file_is_a_fatal_load_error() throws Exception {
        Path file = dir.resolve("id_mapping.json");
        Files.writeString(file, "{\"group\": [\"not\", \"a\", \"map\"]");

        assertThrows(PersistenceException.class, () -> FileIdMappingStore.load(file));
    }

    @Test
    void persistence_failure_is_surfaced_but_keeps_memory_state() throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "a file, not a directory");
        FileIdMappingStore store = FileIdMappingStore.empty(blocker.resolve("id_mapping.json"));

        assertThrows(PersistenceException.class, () -> store.addMapping("group", "g1", "newG1"));
        assertEquals(Optional.of("newG1"), store.getNewId("group", "g1"));
    }
}
