// file: storage/src/main/java/io/envsync/storage/MalformedRecordException.java
package io.envsync.storage;

import java.nio.file.Path;

/**
 * A persisted record file that cannot be read or is not a JSON object.
 * Recoverable: callers log it and skip that single record.
 */
public class MalformedRecordException extends RuntimeException {

    private final Path file;

    public MalformedRecordException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
