// file: sync/src/main/java/io/envsync/sync/association/SourceScopedAssociationHandler.java
package io.envsync.sync.association;

import io.envsync.core.Backend;
import io.envsync.core.BackendException;
import io.envsync.core.ResourceRecord;
import io.envsync.storage.BackupTree;
import io.envsync.storage.IdMappingStore;
import io.envsync.storage.MalformedRecordException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Base for handlers whose records were backed up as a dependent list:
 *
 *   type/listCommand/oldSourceId/recordId.json
 * <p>
 * For each source directory the old source id is translated through
 * mapping[sourceType()]. When {@link #sourceRequired()} holds and the source id
 * is unknown, the whole directory is skipped with one warning. Each record is
 * then turned into an association call by {@link #resolve}; the call is tried
 * with the persisted record as body first and, if that fails, once more with
 * an empty body.
 */
public abstract class SourceScopedAssociationHandler implements AssociationHandler {
    private static final Logger log = Logger.getLogger(SourceScopedAssociationHandler.class.getName());

    /**
     * One association call.
     *
     * @param description human-readable summary for log lines, e.g. "add user X to group Y"
     */
    protected record Call(String resourceType, String command, Map<String, String> params, String description) {}

    /** Resource type of the source directory names. */
    protected abstract String sourceType();

    /** Whether an untranslatable source id disqualifies the whole directory. */
    protected boolean sourceRequired() {
        return true;
    }

    /**
     * Turn one persisted record into a call, translating every endpoint.
     * Log a warning and return empty when an endpoint cannot be resolved.
     *
     * @param newSourceId translated source id; null if untranslatable and not required
     */
    protected abstract Optional<Call> resolve(String oldSourceId, String newSourceId, ResourceRecord record,
                                              IdMappingStore mapping);

    @Override
    public final HandlerOutcome restore(Backend backend, IdMappingStore mapping, BackupTree source) {
        if (!source.exists(resourceType(), listCommand())) {
            log.fine(() -> "No backup found for " + resourceType() + "/" + listCommand() + ", skipping...");
            return HandlerOutcome.NONE;
        }

        int associated = 0;
        int skipped = 0;
        int failed = 0;

        for (String oldSourceId : source.sourceIds(resourceType(), listCommand())) {
            List<String> recordIds = source.recordIds(resourceType(), listCommand(), oldSourceId);
            Optional<String> newSourceId = mapping.getNewId(sourceType(), oldSourceId);

            if (newSourceId.isEmpty() && sourceRequired()) {
                log.warning("Could not find new ID for " + sourceType() + " " + oldSourceId + ", skipping "
                        + recordIds.size() + " " + resourceType() + "/" + listCommand() + " record(s)");
                skipped += recordIds.size();
                continue;
            }

            for (String recordId : recordIds) {
                ResourceRecord record;
                try {
                    record = source.read(resourceType(), listCommand(), oldSourceId, recordId);
                } catch (MalformedRecordException e) {
                    log.warning("Skipping malformed record " + e.getMessage());
                    skipped++;
                    continue;
                }

                Optional<Call> call = resolve(oldSourceId, newSourceId.orElse(null), record, mapping);
                if (call.isEmpty()) {
                    skipped++;
                    continue;
                }

                if (invoke(backend, call.get(), record)) {
                    associated++;
                } else {
                    failed++;
                }
            }
        }
        return new HandlerOutcome(associated, skipped, failed);
    }

    private static boolean invoke(Backend backend, Call call, ResourceRecord record) {
        log.info(() -> capitalize(call.description()) + "...");
        try {
            backend.associate(call.resourceType(), call.command(), call.params(), record);
            return true;
        } catch (BackendException primary) {
            log.info(() -> "Trying alternative form to " + call.description() + " (" + primary.getMessage() + ")");
        }
        try {
            backend.associate(call.resourceType(), call.command(), call.params(), ResourceRecord.empty());
            return true;
        } catch (BackendException e) {
            log.warning("Failed to " + call.description() + ": " + e.getMessage());
            return false;
        }
    }

    /** Translate an endpoint, logging a warning when it is unknown. */
    protected static Optional<String> translate(IdMappingStore mapping, String type, String oldId) {
        Optional<String> newId = mapping.getNewId(type, oldId);
        if (newId.isEmpty()) {
            log.warning("Could not find new ID for " + type + " " + oldId);
        }
        return newId;
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
