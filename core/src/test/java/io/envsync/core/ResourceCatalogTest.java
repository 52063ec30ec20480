// file: core/src/test/java/io/envsync/core/ResourceCatalogTest.java
package io.envsync.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static io.envsync.core.ResourceDescriptor.dependent;
import static io.envsync.core.ResourceDescriptor.independent;
import static io.envsync.core.ResourceDescriptor.singleton;
import static org.junit.jupiter.api.Assertions.*;

class ResourceCatalogTest {

    @Test
    void default_catalog_is_valid() {
        ResourceCatalog catalog = DefaultCatalog.create().validate();

        assertFalse(catalog.independentResources().isEmpty());
        assertFalse(catalog.dependentResources().isEmpty());
        assertFalse(catalog.singletonResources().isEmpty());

        for (ResourceDescriptor d : catalog.dependentResources()) {
            assertTrue(catalog.independent(d.sourceType()).isPresent(), d.key());
        }
    }

    @Test
    void partitions_preserve_declaration_order() {
        var catalog = new ResourceCatalog(List.of(
                dependent("group", "listUsers", "group", "groupId"),
                independent("user", "lists"),
                singleton("orgSetting", "gets"),
                independent("group", "lists"),
                dependent("userFactor", "listFactors", "user", "userId")
        )).validate();

        assertEquals(List.of("user", "group"),
                catalog.independentResources().stream().map(ResourceDescriptor::name).toList());
        assertEquals(List.of("group/listUsers", "userFactor/listFactors"),
                catalog.dependentResources().stream().map(ResourceDescriptor::key).toList());
        assertEquals(1, catalog.singletonResources().size());
        assertEquals(5, catalog.all().size());
    }

    @Test
    void dependent_sharing_its_name_with_the_source_is_not_self_referential() {
        var catalog = new ResourceCatalog(List.of(
                independent("group", "lists"),
                dependent("group", "listUsers", "group", "groupId")
        ));

        assertDoesNotThrow(catalog::validate);
    }

    @Test
    void unresolved_source_type_is_rejected() {
        var catalog = new ResourceCatalog(List.of(
                independent("group", "lists"),
                dependent("policyRules", "listRules", "policy", "policyId")
        ));

        CatalogException e = assertThrows(CatalogException.class, catalog::validate);
        assertTrue(e.getMessage().contains("policy"), e.getMessage());
    }

    @Test
    void self_referential_dependent_is_rejected() {
        var catalog = new ResourceCatalog(List.of(
                dependent("policy", "listRules", "policy", "policyId")
        ));

        CatalogException e = assertThrows(CatalogException.class, catalog::validate);
        assertTrue(e.getMessage().contains("self-referential"), e.getMessage());
    }

    @Test
    void dependent_sourced_from_dependent_is_rejected() {
        var catalog = new ResourceCatalog(List.of(
                independent("authorizationServer", "lists"),
                dependent("authorizationServerPolicy", "list", "authorizationServer", "authServerId"),
                dependent("authorizationServerRules", "listRules", "authorizationServerPolicy", "policyId")
        ));

        CatalogException e = assertThrows(CatalogException.class, catalog::validate);
        assertTrue(e.getMessage().contains("two levels"), e.getMessage());
    }

    @Test
    void missing_source_type_is_rejected() {
        var catalog = new ResourceCatalog(List.of(
                independent("user", "lists"),
                dependent("userFactor", "listFactors", null, "userId")
        ));

        assertThrows(CatalogException.class, catalog::validate);
    }

    @Test
    void duplicate_independent_names_are_rejected() {
        var catalog = new ResourceCatalog(List.of(
                independent("user", "lists"),
                independent("user", "listAll")
        ));

        assertThrows(CatalogException.class, catalog::validate);
    }

    @Test
    void assignment_member_type_must_be_independent() {
        var catalog = new ResourceCatalog(List.of(
                independent("group", "lists"),
                dependent("group", "listUsers", "group", "groupId")
                        .withAssignment(new AssignmentSpec("user", "userId", "group", "addUserToGroup"))
        ));

        CatalogException e = assertThrows(CatalogException.class, catalog::validate);
        assertTrue(e.getMessage().contains("member type"), e.getMessage());
    }

    @Test
    void singleton_with_source_type_is_rejected() {
        var bogus = new ResourceDescriptor("orgSetting", "gets",
                ResourceDescriptor.Retrieval.SINGLETON, ResourceDescriptor.Dependency.INDEPENDENT,
                "user", null, null);

        assertThrows(CatalogException.class, () -> new ResourceCatalog(List.of(bogus)).validate());
    }

    @Test
    void default_parameter_names_follow_source_type() {
        assertEquals("groupId", DefaultCatalog.parameterFor("group"));
        assertEquals("authServerId", DefaultCatalog.parameterFor("authorizationServer"));
        assertEquals("id", DefaultCatalog.parameterFor("somethingElse"));
    }
}
