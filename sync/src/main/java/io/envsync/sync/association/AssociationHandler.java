// file: sync/src/main/java/io/envsync/sync/association/AssociationHandler.java
package io.envsync.sync.association;

import io.envsync.core.Backend;
import io.envsync.storage.BackupTree;
import io.envsync.storage.IdMappingStore;

/**
 * Restores a relation between two already-restored entities (membership, role
 * grant, group assignment) instead of creating a standalone object.
 * <p>
 * Handlers are registered by resource-type name in an {@link AssociationRegistry}.
 * Every dependent list of a registered type is left out of the generic second
 * pass; only the list named by {@link #listCommand()} is replayed, by the handler.
 */
public interface AssociationHandler {

    /** Resource type whose persisted list this handler consumes, e.g. "user". */
    String resourceType();

    /** List command whose persisted records this handler consumes, e.g. "listGroups". */
    String listCommand();

    /**
     * Re-establish every persisted relation whose endpoints can be translated.
     * <p>
     * Unresolvable endpoints and failed calls are logged and counted; they never
     * abort the run.
     */
    HandlerOutcome restore(Backend backend, IdMappingStore mapping, BackupTree source);

    /** Counters reported back to the restore summary. */
    record HandlerOutcome(int associated, int skipped, int failed) {
        public static final HandlerOutcome NONE = new HandlerOutcome(0, 0, 0);
    }
}
