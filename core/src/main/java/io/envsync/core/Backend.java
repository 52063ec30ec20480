// file: core/src/main/java/io/envsync/core/Backend.java
package io.envsync.core;

import java.util.List;
import java.util.Map;

/**
 * Collaborator that talks to the identity platform.
 * <p>
 * Implementations can be:
 *  - a subprocess wrapper around the platform's CLI client,
 *  - an HTTP / SDK client,
 *  - an in-memory fake for tests.
 * <p>
 * All calls are blocking. Any failed call surfaces as a {@link BackendException};
 * callers treat every such failure as recoverable.
 */
public interface Backend {

    /**
     * List the records of a resource type.
     *
     * @param resourceType resource type, e.g. "group"
     * @param command      list command, e.g. "lists" or "listUsers"
     * @param params       parameters such as {"groupId": "00g1"}; empty for independent lists
     */
    List<ResourceRecord> list(String resourceType, String command, Map<String, String> params)
            throws BackendException;

    /** Retrieve a singleton resource. */
    ResourceRecord get(String resourceType, String command) throws BackendException;

    /**
     * Create a record and return it as created, including its newly assigned "id".
     *
     * @param params parameters that place the record, e.g. the parent's id; may be empty
     */
    ResourceRecord create(String resourceType, ResourceRecord record, Map<String, String> params)
            throws BackendException;

    default ResourceRecord create(String resourceType, ResourceRecord record) throws BackendException {
        return create(resourceType, record, Map.of());
    }

    /**
     * Establish a relation between existing entities. Returns nothing.
     *
     * @param endpointParams ids of the related entities, e.g. {"groupId": .., "userId": ..}
     * @param body           request body; {@link ResourceRecord#empty()} for the bare form
     */
    void associate(String resourceType, String command, Map<String, String> endpointParams, ResourceRecord body)
            throws BackendException;
}
