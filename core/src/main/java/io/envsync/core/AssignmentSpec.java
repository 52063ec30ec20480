// file: core/src/main/java/io/envsync/core/AssignmentSpec.java
package io.envsync.core;

import java.util.Objects;

/**
 * Describes how a membership-like dependent list is restored.
 * <p>
 * Records of such a list denote attaching an existing entity (the member) to
 * the source entity rather than creating something new. On restore both ids
 * are translated and the association call is issued:
 *
 *   backend.associate(resourceType, command,
 *                     { sourceParameter: newSourceId, memberParameter: newMemberId })
 *
 * @param memberType      independent resource type of the record's "id"
 * @param memberParameter parameter name carrying the translated member id
 * @param resourceType    resource type of the association call
 * @param command         association command, e.g. "addUserToGroup"
 */
public record AssignmentSpec(
        String memberType,
        String memberParameter,
        String resourceType,
        String command
) {
    public AssignmentSpec {
        Objects.requireNonNull(memberType, "memberType");
        Objects.requireNonNull(memberParameter, "memberParameter");
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(command, "command");
    }
}
