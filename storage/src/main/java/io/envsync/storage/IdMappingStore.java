// file: storage/src/main/java/io/envsync/storage/IdMappingStore.java
package io.envsync.storage;

import java.util.Map;
import java.util.Optional;

/**
 * Translation table from identifiers recorded at backup time ("old") to the
 * identifiers the target org assigned on restore ("new"), per resource type.
 * <p>
 * Semantics:
 *  - addMapping() inserts or overwrites, then persists the whole table before
 *    returning. A persistence failure is thrown; the in-memory entry stays.
 *  - getNewId() is a pure lookup.
 */
public interface IdMappingStore {

    /**
     * @throws PersistenceException if the updated table cannot be persisted
     */
    void addMapping(String resourceType, String oldId, String newId);

    /** New id for an old one; empty when the type or the old id is unknown. */
    Optional<String> getNewId(String resourceType, String oldId);

    /** Number of entries recorded for a type. */
    int size(String resourceType);

    /** Read-only copy of the whole table: type -> (old -> new). */
    Map<String, Map<String, String>> snapshot();

    /** Rewrite the current table to durable storage. */
    void save();
}
