// file: core/src/main/java/io/envsync/core/ResourceDescriptor.java
package io.envsync.core;

import java.util.Objects;

/**
 * Static description of one resource type the org exposes.
 * <p>
 * A descriptor is identified by {@code (name, command)}: the same resource type
 * can appear once as an independent list ("group lists") and again as a
 * dependent list ("group listUsers", parameterized by a group id).
 * <p>
 * Fields:
 *  - name:            resource type as the backend knows it (camelCase)
 *  - command:         list command for listable resources, get command for singletons
 *  - retrieval:       LISTABLE or SINGLETON
 *  - dependency:      INDEPENDENT or DEPENDENT
 *  - sourceType:      independent resource type supplying parameter ids (dependent only)
 *  - sourceParameter: parameter name carrying the source id, e.g. "groupId" (dependent only)
 *  - assignment:      optional; marks a membership-like list (dependent only)
 * <p>
 * Cross-descriptor rules (source resolution, two-level graph) are checked by
 * {@link ResourceCatalog#validate()}, not here, so that a malformed catalog can
 * still be built and then rejected with a {@link CatalogException}.
 */
public record ResourceDescriptor(
        String name,
        String command,
        Retrieval retrieval,
        Dependency dependency,
        String sourceType,
        String sourceParameter,
        AssignmentSpec assignment
) {

    public enum Retrieval { LISTABLE, SINGLETON }

    public enum Dependency { INDEPENDENT, DEPENDENT }

    public ResourceDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(retrieval, "retrieval");
        Objects.requireNonNull(dependency, "dependency");
        if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        if (command.isBlank()) throw new IllegalArgumentException("command must not be blank for " + name);
    }

    public static ResourceDescriptor independent(String name, String listCommand) {
        return new ResourceDescriptor(name, listCommand, Retrieval.LISTABLE, Dependency.INDEPENDENT,
                null, null, null);
    }

    public static ResourceDescriptor singleton(String name, String getCommand) {
        return new ResourceDescriptor(name, getCommand, Retrieval.SINGLETON, Dependency.INDEPENDENT,
                null, null, null);
    }

    public static ResourceDescriptor dependent(String name, String listCommand,
                                               String sourceType, String sourceParameter) {
        return new ResourceDescriptor(name, listCommand, Retrieval.LISTABLE, Dependency.DEPENDENT,
                sourceType, sourceParameter, null);
    }

    /** Same descriptor, marked as a membership-like list restored through an association call. */
    public ResourceDescriptor withAssignment(AssignmentSpec spec) {
        return new ResourceDescriptor(name, command, retrieval, dependency, sourceType, sourceParameter,
                Objects.requireNonNull(spec, "spec"));
    }

    public boolean isSingleton() {
        return retrieval == Retrieval.SINGLETON;
    }

    public boolean isDependent() {
        return dependency == Dependency.DEPENDENT;
    }

    public boolean isAssignment() {
        return assignment != null;
    }

    /** "name/command", used in log lines and duplicate detection. */
    public String key() {
        return name + "/" + command;
    }
}
