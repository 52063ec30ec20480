// file: sync/src/test/java/io/envsync/sync/BackupOrchestratorTest.java
package io.envsync.sync;

import io.envsync.core.ResourceCatalog;
import io.envsync.core.ResourceDescriptor;
import io.envsync.core.ResourceRecord;
import io.envsync.storage.BackupTree;
import io.envsync.storage.PersistenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BackupOrchestratorTest {

    @TempDir Path dir;

    private static final ResourceDescriptor ORG = ResourceDescriptor.singleton("orgSetting", "gets");
    private static final ResourceDescriptor GROUPS = ResourceDescriptor.independent("group", "lists");
    private static final ResourceDescriptor USERS = ResourceDescriptor.independent("user", "lists");
    private static final ResourceDescriptor MEMBERS =
            ResourceDescriptor.dependent("groupMembers", "listMembers", "group", "groupId");

    private static ResourceCatalog catalog() {
        return new ResourceCatalog(List.of(MEMBERS, USERS, GROUPS, ORG));
    }

    private static ResourceRecord rec(String id, String name) {
        return ResourceRecord.withId(id).with("name", name);
    }

    @Test
    void writes_every_pass_under_the_type_and_command_path() {
        FakeBackend backend = new FakeBackend()
                .singleton("orgSetting", "gets", new ResourceRecord(Map.of("companyName", "Acme")))
                .listing("group", "lists", rec("g1", "admins"))
                .listing("groupMembers", "listMembers", "groupId", "g1", rec("u1", "alice"));
        BackupTree tree = new BackupTree(dir.resolve("backup"));

        RunSummary summary = new BackupOrchestrator(catalog(), backend).backup(tree);

        Path root = dir.resolve("backup");
        assertTrue(Files.exists(root.resolve("orgsetting/gets/gets.json")));
        assertTrue(Files.exists(root.resolve("group/lists/g1.json")));
        assertTrue(Files.exists(root.resolve("groupmembers/listMembers/g1/u1.json")));
        assertEquals(rec("g1", "admins"), tree.read(GROUPS, "g1"));
        assertEquals(rec("u1", "alice"), tree.read(MEMBERS, "g1", "u1"));
        assertEquals(3, summary.totalSucceeded());
        assertEquals(0, summary.totalFailed());
    }

    @Test
    void singletons_are_fetched_before_any_listing() {
        FakeBackend backend = new FakeBackend()
                .singleton("orgSetting", "gets", ResourceRecord.withId("org"))
                .listing("group", "lists", rec("g1", "admins"));

        new BackupOrchestrator(catalog(), backend).backup(new BackupTree(dir));

        List<FakeBackend.Call> calls = backend.calls();
        assertEquals("get", calls.get(0).op());
        assertTrue(calls.stream().skip(1).noneMatch(c -> c.op().equals("get")));
    }

    @Test
    void second_pass_walks_the_ids_persisted_by_the_first_pass() {
        FakeBackend backend = new FakeBackend()
                .singleton("orgSetting", "gets", ResourceRecord.withId("org"))
                .listing("group", "lists", rec("g1", "a"), rec("g2", "b"))
                .listing("groupMembers", "listMembers", "groupId", "g1", rec("u1", "alice"));

        new BackupOrchestrator(catalog(), backend).backup(new BackupTree(dir));

        List<String> queried = backend.calls("list", "groupMembers").stream()
                .map(c -> c.params().get("groupId"))
                .collect(Collectors.toList());
        assertEquals(List.of("g1", "g2"), queried);
        // g2 has no members: nothing written for it
        assertFalse(Files.exists(dir.resolve("groupmembers/listMembers/g2")));
    }

    @Test
    void failed_listing_is_counted_and_the_run_continues() {
        FakeBackend backend = new FakeBackend()
                .singleton("orgSetting", "gets", ResourceRecord.withId("org"))
                .failing("list", "user")
                .listing("group", "lists", rec("g1", "admins"));

        RunSummary summary = new BackupOrchestrator(catalog(), backend).backup(new BackupTree(dir));

        assertEquals(1, summary.phase(Phase.FIRST_PASS).failed());
        assertTrue(Files.exists(dir.resolve("group/lists/g1.json")));
        assertFalse(Files.exists(dir.resolve("user/lists")));
    }

    @Test
    void failed_singleton_does_not_stop_the_passes() {
        FakeBackend backend = new FakeBackend()
                .failing("get", "orgSetting")
                .listing("group", "lists", rec("g1", "admins"));

        RunSummary summary = new BackupOrchestrator(catalog(), backend).backup(new BackupTree(dir));

        assertEquals(1, summary.phase(Phase.SINGLETON).failed());
        assertTrue(Files.exists(dir.resolve("group/lists/g1.json")));
    }

    @Test
    void dependent_list_is_skipped_when_its_source_has_no_records() {
        FakeBackend backend = new FakeBackend()
                .singleton("orgSetting", "gets", ResourceRecord.withId("org"));

        RunSummary summary = new BackupOrchestrator(catalog(), backend).backup(new BackupTree(dir));

        assertTrue(backend.calls("list", "groupMembers").isEmpty());
        assertEquals(1, summary.phase(Phase.SECOND_PASS).skipped());
    }

    @Test
    void records_without_a_usable_id_are_skipped() {
        FakeBackend backend = new FakeBackend()
                .singleton("orgSetting", "gets", ResourceRecord.withId("org"))
                .listing("group", "lists",
                        new ResourceRecord(Map.of("name", "anonymous")),
                        rec("../escape", "evil"),
                        rec("g1", "admins"));

        RunSummary summary = new BackupOrchestrator(catalog(), backend).backup(new BackupTree(dir));

        assertEquals(List.of("g1"), new BackupTree(dir).recordIds(GROUPS));
        assertEquals(2, summary.phase(Phase.FIRST_PASS).skipped());
        assertFalse(Files.exists(dir.resolve("escape.json")));
    }

    @Test
    void unwritable_destination_aborts_the_run() throws Exception {
        Path blocker = dir.resolve("not-a-dir");
        Files.writeString(blocker, "x");
        FakeBackend backend = new FakeBackend();

        assertThrows(PersistenceException.class,
                () -> new BackupOrchestrator(catalog(), backend).backup(new BackupTree(blocker)));
        assertTrue(backend.calls().isEmpty());
    }
}
