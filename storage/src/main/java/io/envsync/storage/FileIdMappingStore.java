// file: storage/src/main/java/io/envsync/storage/FileIdMappingStore.java
package io.envsync.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link IdMappingStore} persisted as a single JSON document:
 *
 *   {
 *     "group": { "00gOld1": "00gNew1", ... },
 *     "user":  { ... }
 *   }
 * <p>
 * Atomicity:
 *   - every mutation rewrites the whole document to "name.tmp",
 *   - then moves it over the real file with ATOMIC_MOVE.
 *   A crash loses at most the in-flight mapping and never leaves a torn file.
 * <p>
 * Not thread-safe; a restore run has a single owner.
 */
public final class FileIdMappingStore implements IdMappingStore {
    private static final Logger log = Logger.getLogger(FileIdMappingStore.class.getName());

    public static final String DEFAULT_FILE_NAME = "id_mapping.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, String>>> TABLE =
            new TypeReference<>() {};

    private final Path file;
    private final Map<String, Map<String, String>> mappings;

    private FileIdMappingStore(Path file, Map<String, Map<String, String>> mappings) {
        this.file = file;
        this.mappings = mappings;
    }

    /** Empty store that will persist to the given file. Nothing is read. */
    public static FileIdMappingStore empty(Path file) {
        return new FileIdMappingStore(Objects.requireNonNull(file, "file"), new LinkedHashMap<>());
    }

    /**
     * Load a store from a mapping file.
     * <p>
     * A missing file yields an empty store. Malformed content is fatal.
     *
     * @throws PersistenceException if the file exists but cannot be read or parsed
     */
    public static FileIdMappingStore load(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) {
            log.info(() -> "No id mapping at " + file + ", starting with an empty one");
            return empty(file);
        }
        try {
            LinkedHashMap<String, LinkedHashMap<String, String>> loaded = MAPPER.readValue(file.toFile(), TABLE);
            Map<String, Map<String, String>> table = new LinkedHashMap<>();
            if (loaded != null) {
                loaded.forEach((type, entries) ->
                        table.put(type, entries == null ? new LinkedHashMap<>() : entries));
            }
            log.info(() -> "Loaded id mapping from " + file + " (" + table.size() + " resource types)");
            return new FileIdMappingStore(file, table);
        } catch (IOException e) {
            throw new PersistenceException("cannot load id mapping from " + file, e);
        }
    }

    public Path file() {
        return file;
    }

    @Override
    public void addMapping(String resourceType, String oldId, String newId) {
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(oldId, "oldId");
        Objects.requireNonNull(newId, "newId");
        mappings.computeIfAbsent(resourceType, t -> new LinkedHashMap<>()).put(oldId, newId);
        save();
    }

    @Override
    public Optional<String> getNewId(String resourceType, String oldId) {
        Map<String, String> byType = mappings.get(resourceType);
        if (byType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byType.get(oldId));
    }

    @Override
    public int size(String resourceType) {
        Map<String, String> byType = mappings.get(resourceType);
        return byType == null ? 0 : byType.size();
    }

    @Override
    public Map<String, Map<String, String>> snapshot() {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        mappings.forEach((type, entries) -> copy.put(type, Map.copyOf(entries)));
        return Map.copyOf(copy);
    }

    @Override
    public void save() {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(tmp, MAPPER.writeValueAsBytes(mappings));
            BackupTree.move(tmp, file);
        } catch (IOException e) {
            throw new PersistenceException("cannot persist id mapping to " + file, e);
        }
    }
}
