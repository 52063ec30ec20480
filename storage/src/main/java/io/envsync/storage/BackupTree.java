// file: storage/src/main/java/io/envsync/storage/BackupTree.java
package io.envsync.storage;

import io.envsync.core.ResourceDescriptor;
import io.envsync.core.ResourceRecord;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * On-disk path namespace holding one JSON file per backed-up record.
 * <p>
 * Layout:
 *   root/lowercased-type/command/recordId.json              (independent lists)
 *   root/lowercased-type/command/sourceId/recordId.json     (dependent lists)
 *   root/lowercased-type/getCommand/recordId.json           (singletons)
 * <p>
 * The file name is the identifier, so listing a directory recovers the full set
 * of ids without reading any content. Backup's second pass and the whole
 * restore rely on that.
 * <p>
 * Listing results are sorted by name. A missing directory lists as empty; use
 * {@link #exists} to tell "never written" apart from "written, but empty".
 */
public final class BackupTree {

    public static final String EXTENSION = ".json";

    private final Path root;

    public BackupTree(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Path root() {
        return root;
    }

    /** Create the root directory if needed. */
    public void ensureRoot() {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new PersistenceException("cannot create backup directory " + root, e);
        }
    }

    // ---------- paths ----------

    public Path directory(String resourceType, String command) {
        return root.resolve(resourceType.toLowerCase(Locale.ROOT)).resolve(command);
    }

    public Path directory(ResourceDescriptor d) {
        return directory(d.name(), d.command());
    }

    public Path directory(ResourceDescriptor d, String sourceId) {
        return directory(d).resolve(requireSafe(sourceId));
    }

    public boolean exists(ResourceDescriptor d) {
        return Files.isDirectory(directory(d));
    }

    public boolean exists(String resourceType, String command) {
        return Files.isDirectory(directory(resourceType, command));
    }

    // ---------- writes ----------

    /** Persist a first-pass or singleton record. Overwrites an existing file. */
    public Path write(ResourceDescriptor d, String recordId, ResourceRecord record) {
        return writeFile(directory(d), recordId, record);
    }

    /** Persist a second-pass record under its source id. Overwrites an existing file. */
    public Path write(ResourceDescriptor d, String sourceId, String recordId, ResourceRecord record) {
        return writeFile(directory(d, sourceId), recordId, record);
    }

    private static Path writeFile(Path dir, String recordId, ResourceRecord record) {
        Path dst = dir.resolve(requireSafe(recordId) + EXTENSION);
        Path tmp = dir.resolve(recordId + EXTENSION + ".tmp");
        try {
            Files.createDirectories(dir);
            Files.write(tmp, RecordCodec.encode(record));
            move(tmp, dst);
            return dst;
        } catch (IOException e) {
            throw new PersistenceException("cannot write " + dst, e);
        }
    }

    static void move(Path tmp, Path dst) throws IOException {
        try {
            Files.move(tmp, dst, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, dst, REPLACE_EXISTING);
        }
    }

    // ---------- listings ----------

    /** Ids of the records persisted directly under the descriptor's directory. */
    public List<String> recordIds(ResourceDescriptor d) {
        return recordIds(directory(d));
    }

    public List<String> recordIds(String resourceType, String command) {
        return recordIds(directory(resourceType, command));
    }

    /** Ids of the records persisted for one source id of a dependent list. */
    public List<String> recordIds(ResourceDescriptor d, String sourceId) {
        return recordIds(directory(d, sourceId));
    }

    public List<String> recordIds(String resourceType, String command, String sourceId) {
        return recordIds(directory(resourceType, command).resolve(requireSafe(sourceId)));
    }

    /** Source ids (subdirectory names) of a dependent list. */
    public List<String> sourceIds(ResourceDescriptor d) {
        return sourceIds(d.name(), d.command());
    }

    public List<String> sourceIds(String resourceType, String command) {
        return list(directory(resourceType, command), Files::isDirectory)
                .stream()
                .map(p -> p.getFileName().toString())
                .toList();
    }

    private static List<String> recordIds(Path dir) {
        return list(dir, p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(EXTENSION))
                .stream()
                .map(p -> {
                    String name = p.getFileName().toString();
                    return name.substring(0, name.length() - EXTENSION.length());
                })
                .filter(id -> !id.isEmpty())
                .toList();
    }

    private static List<Path> list(Path dir, Predicate<Path> filter) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(filter).sorted().toList();
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new PersistenceException("cannot list " + dir, e);
        }
    }

    // ---------- reads ----------

    public ResourceRecord read(ResourceDescriptor d, String recordId) {
        return readFile(directory(d).resolve(requireSafe(recordId) + EXTENSION));
    }

    public ResourceRecord read(ResourceDescriptor d, String sourceId, String recordId) {
        return readFile(directory(d, sourceId).resolve(requireSafe(recordId) + EXTENSION));
    }

    public ResourceRecord read(String resourceType, String command, String sourceId, String recordId) {
        return readFile(directory(resourceType, command)
                .resolve(requireSafe(sourceId))
                .resolve(requireSafe(recordId) + EXTENSION));
    }

    /**
     * @throws MalformedRecordException if the file is unreadable or not a JSON object
     */
    public static ResourceRecord readFile(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new MalformedRecordException(file, "cannot read", e);
        }
        try {
            return RecordCodec.decode(bytes);
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(file, e.getMessage(), e);
        }
    }

    // ---------- ids ----------

    /**
     * An id is usable as a file or directory name when it is non-blank, is not
     * "." or "..", and contains no path separator or NUL.
     */
    public static boolean isSafeId(String id) {
        if (id == null || id.isBlank() || id.equals(".") || id.equals("..")) {
            return false;
        }
        return id.indexOf('/') < 0 && id.indexOf('\\') < 0 && id.indexOf('\0') < 0;
    }

    private static String requireSafe(String id) {
        if (!isSafeId(id)) {
            throw new IllegalArgumentException("not a usable identifier: '" + id + "'");
        }
        return id;
    }
}
