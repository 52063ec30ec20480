// file: sync/src/main/java/io/envsync/sync/association/ApplicationGroupsHandler.java
package io.envsync.sync.association;

import io.envsync.core.ResourceRecord;
import io.envsync.storage.IdMappingStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Application-to-group assignments
 * (applicationgroups/listApplicationGroupAssignments/oldAppId/oldGroupId.json).
 * <p>
 * The record carries both endpoints: "appId" for the application (falls back
 * to the directory name) and "id" for the group. Both are translated
 * independently; if either is unknown nothing is called.
 * Call: applicationGroups assignGroupToApplication --appId newAppId --groupId newGroupId
 */
public final class ApplicationGroupsHandler extends SourceScopedAssociationHandler {
    private static final Logger log = Logger.getLogger(ApplicationGroupsHandler.class.getName());

    @Override
    public String resourceType() {
        return "applicationGroups";
    }

    @Override
    public String listCommand() {
        return "listApplicationGroupAssignments";
    }

    @Override
    protected String sourceType() {
        return "application";
    }

    @Override
    protected boolean sourceRequired() {
        // the record's own appId decides
        return false;
    }

    @Override
    protected Optional<Call> resolve(String oldSourceId, String newSourceId, ResourceRecord record,
                                     IdMappingStore mapping) {
        String oldAppId = record.string("appId").orElse(oldSourceId);
        Optional<String> oldGroupId = record.id();
        if (oldGroupId.isEmpty()) {
            log.warning("Missing id in group assignment of application " + oldAppId);
            return Optional.empty();
        }

        Optional<String> newAppId = translate(mapping, "application", oldAppId);
        Optional<String> newGroupId = translate(mapping, "group", oldGroupId.get());
        if (newAppId.isEmpty() || newGroupId.isEmpty()) {
            return Optional.empty();
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("appId", newAppId.get());
        params.put("groupId", newGroupId.get());
        return Optional.of(new Call("applicationGroups", "assignGroupToApplication", params,
                "assign group " + newGroupId.get() + " to application " + newAppId.get()));
    }
}
