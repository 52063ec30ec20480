// file: sync/src/test/java/io/envsync/sync/association/AssociationRegistryTest.java
package io.envsync.sync.association;

import io.envsync.core.ResourceDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssociationRegistryTest {

    @Test
    void claims_every_list_of_a_handled_type() {
        AssociationRegistry registry = AssociationRegistry.defaults();

        assertTrue(registry.claims(ResourceDescriptor.dependent("user", "listGroups", "user", "userId")));
        // app links and grants are not users; they must never reach the generic create
        assertTrue(registry.claims(ResourceDescriptor.dependent("user", "listAppLinks", "user", "userId")));
        assertTrue(registry.claims(ResourceDescriptor.dependent("user", "listGrants", "user", "userId")));
        assertFalse(registry.claims(ResourceDescriptor.dependent("userFactor", "listFactors", "user", "userId")));
        assertFalse(registry.claims(ResourceDescriptor.independent("group", "lists")));
    }

    @Test
    void lookup_is_by_resource_type() {
        AssociationRegistry registry = AssociationRegistry.defaults();

        assertTrue(registry.lookup("roleAssignment").orElseThrow() instanceof RoleAssignmentHandler);
        assertTrue(registry.lookup("applicationGroups").orElseThrow() instanceof ApplicationGroupsHandler);
        assertTrue(registry.lookup("policy").isEmpty());
        assertEquals(3, registry.handlers().size());
    }

    @Test
    void duplicate_registration_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new AssociationRegistry(List.of(new UserGroupsHandler(), new UserGroupsHandler())));
    }

    @Test
    void empty_registry_claims_nothing() {
        assertFalse(AssociationRegistry.empty()
                .claims(ResourceDescriptor.dependent("user", "listGroups", "user", "userId")));
    }
}
