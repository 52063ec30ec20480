// file: sync/src/main/java/io/envsync/sync/association/RoleAssignmentHandler.java
package io.envsync.sync.association;

import io.envsync.core.ResourceRecord;
import io.envsync.storage.IdMappingStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Admin role grants backed up per user
 * (roleassignment/listAssignedRolesForUser/oldUserId/assignmentId.json).
 * <p>
 * Endpoints: the user from the directory name; the role is identified by the
 * record's "type" (e.g. "ORG_ADMIN"), which is the same in every org.
 * Call: role assignRoleToUser --userId newUserId --type roleType
 */
public final class RoleAssignmentHandler extends SourceScopedAssociationHandler {
    private static final Logger log = Logger.getLogger(RoleAssignmentHandler.class.getName());

    @Override
    public String resourceType() {
        return "roleAssignment";
    }

    @Override
    public String listCommand() {
        return "listAssignedRolesForUser";
    }

    @Override
    protected String sourceType() {
        return "user";
    }

    @Override
    protected Optional<Call> resolve(String oldUserId, String newUserId, ResourceRecord record,
                                     IdMappingStore mapping) {
        Optional<String> roleType = record.string("type");
        if (roleType.isEmpty()) {
            log.warning("Missing role type in role assignment of user " + oldUserId);
            return Optional.empty();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("userId", newUserId);
        params.put("type", roleType.get());
        return Optional.of(new Call("role", "assignRoleToUser", params,
                "assign role " + roleType.get() + " to user " + newUserId));
    }
}
