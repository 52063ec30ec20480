// file: core/src/main/java/io/envsync/core/ResourceCatalog.java
package io.envsync.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, declaration-ordered table of resource types.
 * <p>
 * The catalog is partitioned into three sequences:
 *  - singletonResources():   fetched with a single get call,
 *  - independentResources(): listable without any other id (first pass),
 *  - dependentResources():   listable per id of an independent source type (second pass).
 * <p>
 * Declaration order only affects log readability. Correctness comes from the
 * pass structure: every dependent list runs after all independent lists.
 * <p>
 * The dependency graph has exactly two levels. {@link #validate()} rejects a
 * dependent descriptor whose sourceType is missing, unresolved, itself, or
 * another dependent descriptor.
 */
public final class ResourceCatalog {

    private final List<ResourceDescriptor> singletons;
    private final List<ResourceDescriptor> independent;
    private final List<ResourceDescriptor> dependent;

    public ResourceCatalog(List<ResourceDescriptor> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors");
        List<ResourceDescriptor> s = new ArrayList<>();
        List<ResourceDescriptor> i = new ArrayList<>();
        List<ResourceDescriptor> d = new ArrayList<>();
        for (ResourceDescriptor r : descriptors) {
            Objects.requireNonNull(r, "descriptor");
            if (r.isSingleton()) {
                s.add(r);
            } else if (r.isDependent()) {
                d.add(r);
            } else {
                i.add(r);
            }
        }
        this.singletons = List.copyOf(s);
        this.independent = List.copyOf(i);
        this.dependent = List.copyOf(d);
    }

    public List<ResourceDescriptor> singletonResources() {
        return singletons;
    }

    public List<ResourceDescriptor> independentResources() {
        return independent;
    }

    public List<ResourceDescriptor> dependentResources() {
        return dependent;
    }

    /** All descriptors: singletons, then independent, then dependent. */
    public List<ResourceDescriptor> all() {
        List<ResourceDescriptor> out = new ArrayList<>(singletons.size() + independent.size() + dependent.size());
        out.addAll(singletons);
        out.addAll(independent);
        out.addAll(dependent);
        return List.copyOf(out);
    }

    /** Independent descriptor with the given name, i.e. the one that supplies ids for that type. */
    public Optional<ResourceDescriptor> independent(String name) {
        return independent.stream()
                .filter(r -> r.name().equals(name))
                .findFirst();
    }

    /**
     * Check referential integrity of the catalog.
     *
     * @return this catalog, for chaining
     * @throws CatalogException on the first violation found
     */
    public ResourceCatalog validate() {
        Set<String> independentNames = new HashSet<>();
        for (ResourceDescriptor r : independent) {
            if (!independentNames.add(r.name())) {
                throw new CatalogException("duplicate independent resource type: " + r.name());
            }
        }

        for (ResourceDescriptor r : singletons) {
            rejectDependencyAttributes(r, "singleton");
        }
        for (ResourceDescriptor r : independent) {
            rejectDependencyAttributes(r, "independent");
        }

        Set<String> dependentKeys = new HashSet<>();
        Set<String> dependentNames = new HashSet<>();
        dependent.forEach(r -> dependentNames.add(r.name()));

        for (ResourceDescriptor r : dependent) {
            if (!dependentKeys.add(r.key())) {
                throw new CatalogException("duplicate dependent resource: " + r.key());
            }
            String source = r.sourceType();
            if (source == null || source.isBlank()) {
                throw new CatalogException("dependent resource " + r.key() + " has no sourceType");
            }
            if (r.sourceParameter() == null || r.sourceParameter().isBlank()) {
                throw new CatalogException("dependent resource " + r.key() + " has no sourceParameter");
            }
            if (!independentNames.contains(source)) {
                if (source.equals(r.name())) {
                    throw new CatalogException("dependent resource " + r.key() + " is self-referential");
                }
                if (dependentNames.contains(source)) {
                    throw new CatalogException("dependent resource " + r.key()
                            + " is sourced from dependent type " + source + "; only two levels are allowed");
                }
                throw new CatalogException("dependent resource " + r.key()
                        + " references unknown sourceType " + source);
            }
            if (r.isAssignment() && !independentNames.contains(r.assignment().memberType())) {
                throw new CatalogException("assignment " + r.key()
                        + " references unknown member type " + r.assignment().memberType());
            }
        }
        return this;
    }

    private static void rejectDependencyAttributes(ResourceDescriptor r, String kind) {
        if (r.sourceType() != null) {
            throw new CatalogException(kind + " resource " + r.key() + " must not declare a sourceType");
        }
        if (r.isAssignment()) {
            throw new CatalogException(kind + " resource " + r.key() + " must not declare an assignment");
        }
    }

    @Override
    public String toString() {
        return "ResourceCatalog{" +
                "singletons=" + singletons.size() +
                ", independent=" + independent.size() +
                ", dependent=" + dependent.size() +
                '}';
    }
}
