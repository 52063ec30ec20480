// file: sync/src/main/java/io/envsync/sync/RestoreOrchestrator.java
package io.envsync.sync;

import io.envsync.core.AssignmentSpec;
import io.envsync.core.Backend;
import io.envsync.core.BackendException;
import io.envsync.core.ResourceCatalog;
import io.envsync.core.ResourceDescriptor;
import io.envsync.core.ResourceRecord;
import io.envsync.storage.BackupTree;
import io.envsync.storage.IdMappingStore;
import io.envsync.storage.MalformedRecordException;
import io.envsync.storage.PersistenceException;
import io.envsync.sync.association.AssociationHandler;
import io.envsync.sync.association.AssociationRegistry;

import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replays a backup tree into the target org and rebuilds cross-object references.
 * <p>
 * Phases (strictly sequential, each one completes before the next starts):
 *  1) SINGLETON:   every persisted singleton file goes through backend.create().
 *  2) FIRST_PASS:  every independent record is created; the old id (file name)
 *                  is mapped to the new id (created record's "id").
 *  3) SECOND_PASS: dependent records are created under the translated source id.
 *                  Assignment lists attach the translated member instead.
 *                  Types with an association handler are never created here.
 *  4) ASSOCIATION: registered handlers re-establish relations between entities
 *                  restored in phase 2.
 * <p>
 * Failure policy:
 *  - backend failures, missing mapping entries, malformed files: logged, item skipped;
 *  - {@link PersistenceException} while recording a mapping: fatal, the run aborts,
 *    because a mapping that cannot be persisted breaks a later resume.
 * <p>
 * An instance drives exactly one run.
 */
public final class RestoreOrchestrator {
    private static final Logger log = Logger.getLogger(RestoreOrchestrator.class.getName());

    private final ResourceCatalog catalog;
    private final Backend backend;
    private final AssociationRegistry associations;
    private final RestoreOptions options;

    private Phase phase = Phase.INIT;

    public RestoreOrchestrator(ResourceCatalog catalog, Backend backend, AssociationRegistry associations,
                               RestoreOptions options) {
        this.catalog = Objects.requireNonNull(catalog, "catalog").validate();
        this.backend = Objects.requireNonNull(backend, "backend");
        this.associations = Objects.requireNonNull(associations, "associations");
        this.options = Objects.requireNonNull(options, "options");
    }

    public RestoreOrchestrator(ResourceCatalog catalog, Backend backend) {
        this(catalog, backend, AssociationRegistry.defaults(), RestoreOptions.DEFAULTS);
    }

    /** Current phase; DONE after a completed run. */
    public Phase phase() {
        return phase;
    }

    public RunSummary restore(BackupTree source, IdMappingStore mapping) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(mapping, "mapping");
        if (phase != Phase.INIT) {
            throw new IllegalStateException("restore already ran (phase " + phase + ")");
        }
        if (!Files.isDirectory(source.root())) {
            throw new PersistenceException("backup directory " + source.root() + " does not exist");
        }
        log.info(() -> "Restoring from " + source.root());

        RunSummary summary = new RunSummary("restore");
        boolean completed = false;
        try {
            enter(Phase.SINGLETON);
            restoreSingletons(source, summary.phase(Phase.SINGLETON));

            enter(Phase.FIRST_PASS);
            restoreFirstPass(source, mapping, summary.phase(Phase.FIRST_PASS));

            enter(Phase.SECOND_PASS);
            restoreSecondPass(source, mapping, summary.phase(Phase.SECOND_PASS));

            enter(Phase.ASSOCIATION);
            restoreAssociations(source, mapping, summary.phase(Phase.ASSOCIATION));

            phase = Phase.DONE;
            completed = true;
        } finally {
            RunLogger.logSummary(summary, completed);
        }
        return summary;
    }

    private void enter(Phase next) {
        if (next.ordinal() != phase.ordinal() + 1) {
            throw new IllegalStateException("cannot move from " + phase + " to " + next);
        }
        phase = next;
        RunLogger.phaseStarted("restore", next);
    }

    // ---------- phase 1 ----------

    private void restoreSingletons(BackupTree tree, RunSummary.PhaseStats stats) {
        for (ResourceDescriptor d : catalog.singletonResources()) {
            if (!tree.exists(d)) {
                log.fine(() -> "No backup found for " + d.key() + ", skipping...");
                continue;
            }
            log.info(() -> "Restoring " + d.name() + " using " + d.command() + " command...");
            for (String fileId : tree.recordIds(d)) {
                Optional<ResourceRecord> record = read(tree, d, null, fileId, stats);
                if (record.isEmpty()) {
                    continue;
                }
                try {
                    backend.create(d.name(), record.get());
                    stats.recordSucceeded();
                } catch (BackendException e) {
                    logCreateFailure(d, fileId, e);
                    stats.recordFailed();
                }
            }
        }
    }

    // ---------- phase 2 ----------

    private void restoreFirstPass(BackupTree tree, IdMappingStore mapping, RunSummary.PhaseStats stats) {
        for (ResourceDescriptor d : catalog.independentResources()) {
            if (!tree.exists(d)) {
                log.info(() -> "No backup found for " + d.key() + ", skipping...");
                continue;
            }
            log.info(() -> "Restoring " + d.name() + " resources...");

            for (String oldId : tree.recordIds(d)) {
                if (options.skipMapped() && mapping.getNewId(d.name(), oldId).isPresent()) {
                    log.info(() -> "Skipping " + d.name() + " " + oldId + ", already mapped");
                    stats.recordSkipped();
                    continue;
                }
                Optional<ResourceRecord> record = read(tree, d, null, oldId, stats);
                if (record.isEmpty()) {
                    continue;
                }

                log.fine(() -> "Restoring " + d.name() + " from previous ID " + oldId + "...");
                ResourceRecord created;
                try {
                    created = backend.create(d.name(), record.get());
                } catch (BackendException e) {
                    logCreateFailure(d, oldId, e);
                    stats.recordFailed();
                    continue;
                }

                Optional<String> newId = created.id();
                if (newId.isEmpty()) {
                    log.warning("Created " + d.name() + " from " + oldId + " but the response has no id; "
                            + "dependents of it cannot be restored");
                    stats.recordSkipped();
                    continue;
                }
                mapping.addMapping(d.name(), oldId, newId.get());
                log.info(() -> "Mapped " + d.name() + " old ID " + oldId + " to new ID " + newId.get());
                stats.recordSucceeded();
            }
        }
    }

    // ---------- phase 3 ----------

    private void restoreSecondPass(BackupTree tree, IdMappingStore mapping, RunSummary.PhaseStats stats) {
        for (ResourceDescriptor d : catalog.dependentResources()) {
            if (associations.claims(d)) {
                log.fine(() -> d.key() + " belongs to an association type, not created");
                continue;
            }
            if (!tree.exists(d)) {
                log.fine(() -> "No backup found for " + d.key() + ", skipping...");
                continue;
            }
            log.info(() -> "Restoring " + d.name() + " using " + d.command() + " command...");

            for (String oldSourceId : tree.sourceIds(d)) {
                List<String> recordIds = tree.recordIds(d, oldSourceId);
                Optional<String> newSourceId = mapping.getNewId(d.sourceType(), oldSourceId);
                if (newSourceId.isEmpty()) {
                    log.warning("Could not find new ID for " + d.sourceType() + " " + oldSourceId
                            + ", skipping " + recordIds.size() + " " + d.key() + " record(s)...");
                    stats.recordSkipped(recordIds.size());
                    continue;
                }

                for (String recordId : recordIds) {
                    Optional<ResourceRecord> record = read(tree, d, oldSourceId, recordId, stats);
                    if (record.isEmpty()) {
                        continue;
                    }
                    if (d.isAssignment()) {
                        restoreAssignment(d, newSourceId.get(), recordId, record.get(), mapping, stats);
                    } else {
                        restoreDependent(d, newSourceId.get(), recordId, record.get(), stats);
                    }
                }
            }
        }
    }

    private void restoreDependent(ResourceDescriptor d, String newSourceId, String recordId,
                                  ResourceRecord record, RunSummary.PhaseStats stats) {
        try {
            backend.create(d.name(), record, Map.of(d.sourceParameter(), newSourceId));
            stats.recordSucceeded();
        } catch (BackendException e) {
            log.warning("Failed to restore " + d.key() + " " + recordId + " for " + d.sourceType() + " "
                    + newSourceId + ": " + e.getMessage());
            stats.recordFailed();
        }
    }

    private void restoreAssignment(ResourceDescriptor d, String newSourceId, String recordId,
                                   ResourceRecord record, IdMappingStore mapping, RunSummary.PhaseStats stats) {
        AssignmentSpec a = d.assignment();
        String oldMemberId = record.id().orElse(recordId);
        Optional<String> newMemberId = mapping.getNewId(a.memberType(), oldMemberId);
        if (newMemberId.isEmpty()) {
            log.warning("Could not find new ID for " + a.memberType() + " " + oldMemberId + ", skipping "
                    + d.key() + " assignment to " + d.sourceType() + " " + newSourceId);
            stats.recordSkipped();
            return;
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put(d.sourceParameter(), newSourceId);
        params.put(a.memberParameter(), newMemberId.get());
        try {
            backend.associate(a.resourceType(), a.command(), params, ResourceRecord.empty());
            stats.recordSucceeded();
        } catch (BackendException e) {
            log.warning("Failed to " + a.command() + " " + params + ": " + e.getMessage());
            stats.recordFailed();
        }
    }

    // ---------- phase 4 ----------

    private void restoreAssociations(BackupTree tree, IdMappingStore mapping, RunSummary.PhaseStats stats) {
        for (AssociationHandler h : associations.handlers()) {
            log.info(() -> "Restoring " + h.resourceType() + "/" + h.listCommand() + "...");
            try {
                AssociationHandler.HandlerOutcome outcome = h.restore(backend, mapping, tree);
                stats.add(outcome.associated(), outcome.skipped(), outcome.failed());
            } catch (PersistenceException e) {
                log.log(Level.WARNING, "Error restoring " + h.resourceType() + ": " + e.getMessage(), e);
                stats.recordFailed();
            }
        }
    }

    // ---------- helpers ----------

    private static Optional<ResourceRecord> read(BackupTree tree, ResourceDescriptor d, String sourceId,
                                                 String recordId, RunSummary.PhaseStats stats) {
        try {
            return Optional.of(sourceId == null ? tree.read(d, recordId) : tree.read(d, sourceId, recordId));
        } catch (MalformedRecordException e) {
            log.warning("Skipping malformed record " + e.getMessage());
            stats.recordSkipped();
            return Optional.empty();
        }
    }

    private static void logCreateFailure(ResourceDescriptor d, String oldId, BackendException e) {
        if (e.alreadyExists()) {
            log.warning(d.name() + " " + oldId + " already exists in the target org, not mapped: "
                    + e.getMessage());
        } else {
            log.warning("Error restoring " + d.name() + " from " + oldId + ": " + e.getMessage());
        }
    }
}
