// file: sync/src/main/java/io/envsync/sync/association/AssociationRegistry.java
package io.envsync.sync.association;

import io.envsync.core.ResourceDescriptor;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Association handlers keyed by resource-type name, in registration order.
 * Types without a handler fall through to the generic second pass.
 */
public final class AssociationRegistry {

    private final Map<String, AssociationHandler> handlers = new LinkedHashMap<>();

    public AssociationRegistry(List<? extends AssociationHandler> handlers) {
        for (AssociationHandler h : handlers) {
            register(h);
        }
    }

    /** Handlers for user-to-group memberships, role grants and application group assignments. */
    public static AssociationRegistry defaults() {
        return new AssociationRegistry(List.of(
                new ApplicationGroupsHandler(),
                new UserGroupsHandler(),
                new RoleAssignmentHandler()
        ));
    }

    public static AssociationRegistry empty() {
        return new AssociationRegistry(List.of());
    }

    private void register(AssociationHandler handler) {
        Objects.requireNonNull(handler, "handler");
        AssociationHandler previous = handlers.putIfAbsent(handler.resourceType(), handler);
        if (previous != null) {
            throw new IllegalArgumentException("duplicate association handler for " + handler.resourceType());
        }
    }

    public Optional<AssociationHandler> lookup(String resourceType) {
        return Optional.ofNullable(handlers.get(resourceType));
    }

    /** True when the descriptor's type has a handler; the generic second pass must not touch it. */
    public boolean claims(ResourceDescriptor d) {
        return handlers.containsKey(d.name());
    }

    public Collection<AssociationHandler> handlers() {
        return List.copyOf(handlers.values());
    }
}
