// file: sync/src/main/java/io/envsync/sync/BackupOrchestrator.java
package io.envsync.sync;

import io.envsync.core.Backend;
import io.envsync.core.BackendException;
import io.envsync.core.ResourceCatalog;
import io.envsync.core.ResourceDescriptor;
import io.envsync.core.ResourceRecord;
import io.envsync.storage.BackupTree;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Walks the catalog and persists every record the backend returns.
 * <p>
 * Passes, in order:
 *  1) singletons:  backend.get(), one file per descriptor,
 *  2) first pass:  backend.list() per independent descriptor, one file per record,
 *  3) second pass: backend.list() per dependent descriptor and per source id.
 * <p>
 * Source ids for the second pass come from the file names the first pass
 * wrote, never from a fresh query. Whatever was persisted is what gets walked.
 * <p>
 * Failure policy: a failed backend call, a missing source directory or a record
 * without a usable id is logged and skipped. Only storage faults
 * ({@link io.envsync.storage.PersistenceException}) abort the run.
 */
public final class BackupOrchestrator {
    private static final Logger log = Logger.getLogger(BackupOrchestrator.class.getName());

    private final ResourceCatalog catalog;
    private final Backend backend;

    public BackupOrchestrator(ResourceCatalog catalog, Backend backend) {
        this.catalog = Objects.requireNonNull(catalog, "catalog").validate();
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    public RunSummary backup(BackupTree destination) {
        Objects.requireNonNull(destination, "destination");
        destination.ensureRoot();
        log.info(() -> "Backing up to " + destination.root());

        RunSummary summary = new RunSummary("backup");
        boolean completed = false;
        try {
            RunLogger.phaseStarted("backup", Phase.SINGLETON);
            backupSingletons(destination, summary.phase(Phase.SINGLETON));

            RunLogger.phaseStarted("backup", Phase.FIRST_PASS);
            backupFirstPass(destination, summary.phase(Phase.FIRST_PASS));

            RunLogger.phaseStarted("backup", Phase.SECOND_PASS);
            backupSecondPass(destination, summary.phase(Phase.SECOND_PASS));
            completed = true;
        } finally {
            RunLogger.logSummary(summary, completed);
        }
        return summary;
    }

    // ---------- passes ----------

    private void backupSingletons(BackupTree tree, RunSummary.PhaseStats stats) {
        for (ResourceDescriptor d : catalog.singletonResources()) {
            log.info(() -> "Backing up " + d.name() + " using " + d.command() + " command...");
            ResourceRecord record;
            try {
                record = backend.get(d.name(), d.command());
            } catch (BackendException e) {
                log.warning("Failed to execute " + d.key() + " backup: " + e.getMessage());
                stats.recordFailed();
                continue;
            }
            // Singletons rarely carry an id; the get command names the file then.
            String fileId = record.id().filter(BackupTree::isSafeId).orElse(d.command());
            tree.write(d, fileId, record);
            stats.recordSucceeded();
        }
    }

    private void backupFirstPass(BackupTree tree, RunSummary.PhaseStats stats) {
        for (ResourceDescriptor d : catalog.independentResources()) {
            log.info(() -> "Backing up " + d.name() + " using " + d.command() + " command...");
            List<ResourceRecord> records;
            try {
                records = backend.list(d.name(), d.command(), Map.of());
            } catch (BackendException e) {
                log.warning("Failed to execute " + d.key() + " backup: " + e.getMessage());
                stats.recordFailed();
                continue;
            }
            for (ResourceRecord record : records) {
                persist(tree, d, null, record, stats);
            }
        }
    }

    private void backupSecondPass(BackupTree tree, RunSummary.PhaseStats stats) {
        for (ResourceDescriptor d : catalog.dependentResources()) {
            // validate() guarantees the source exists
            ResourceDescriptor source = catalog.independent(d.sourceType()).orElseThrow();

            if (!tree.exists(source)) {
                log.warning("Source directory " + tree.directory(source) + " not found for "
                        + d.key() + ", skipping...");
                stats.recordSkipped();
                continue;
            }

            List<String> sourceIds = tree.recordIds(source);
            if (sourceIds.isEmpty()) {
                log.warning("No IDs found in " + tree.directory(source) + " for " + d.key() + ", skipping...");
                stats.recordSkipped();
                continue;
            }
            log.info(() -> "Found " + sourceIds.size() + " IDs for " + d.key() + " in " + tree.directory(source));

            for (String sourceId : sourceIds) {
                log.fine(() -> "Backing up " + d.key() + " for " + d.sourceType() + " " + sourceId);
                List<ResourceRecord> records;
                try {
                    records = backend.list(d.name(), d.command(), Map.of(d.sourceParameter(), sourceId));
                } catch (BackendException e) {
                    log.warning("Failed to execute " + d.key() + " backup for ID " + sourceId + ": "
                            + e.getMessage());
                    stats.recordFailed();
                    continue;
                }
                for (ResourceRecord record : records) {
                    persist(tree, d, sourceId, record, stats);
                }
            }
        }
    }

    private static void persist(BackupTree tree, ResourceDescriptor d, String sourceId, ResourceRecord record,
                                RunSummary.PhaseStats stats) {
        Optional<String> id = record.id();
        if (id.isEmpty()) {
            log.warning("Record of " + d.key() + (sourceId == null ? "" : " for " + sourceId)
                    + " has no id, skipping");
            stats.recordSkipped();
            return;
        }
        if (!BackupTree.isSafeId(id.get())) {
            log.warning("Record of " + d.key() + " has unusable id '" + id.get() + "', skipping");
            stats.recordSkipped();
            return;
        }
        if (sourceId == null) {
            tree.write(d, id.get(), record);
        } else {
            tree.write(d, sourceId, id.get(), record);
        }
        stats.recordSucceeded();
    }
}
