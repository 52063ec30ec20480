// file: sync/src/main/java/io/envsync/sync/association/UserGroupsHandler.java
package io.envsync.sync.association;

import io.envsync.core.ResourceRecord;
import io.envsync.storage.IdMappingStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Group memberships backed up per user (user/listGroups/oldUserId/oldGroupId.json).
 * <p>
 * Endpoints: the user from the directory name, the group from the record's "id".
 * Call: group addUserToGroup --groupId newGroupId --userId newUserId
 */
public final class UserGroupsHandler extends SourceScopedAssociationHandler {
    private static final Logger log = Logger.getLogger(UserGroupsHandler.class.getName());

    @Override
    public String resourceType() {
        return "user";
    }

    @Override
    public String listCommand() {
        return "listGroups";
    }

    @Override
    protected String sourceType() {
        return "user";
    }

    @Override
    protected Optional<Call> resolve(String oldUserId, String newUserId, ResourceRecord record,
                                     IdMappingStore mapping) {
        Optional<String> oldGroupId = record.id();
        if (oldGroupId.isEmpty()) {
            log.warning("Missing id in group membership of user " + oldUserId);
            return Optional.empty();
        }
        return translate(mapping, "group", oldGroupId.get()).map(newGroupId -> {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("groupId", newGroupId);
            params.put("userId", newUserId);
            return new Call("group", "addUserToGroup", params,
                    "add user " + newUserId + " to group " + newGroupId);
        });
    }
}
