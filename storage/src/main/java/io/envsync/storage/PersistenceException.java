// file: storage/src/main/java/io/envsync/storage/PersistenceException.java
package io.envsync.storage;

/**
 * Fatal storage failure: an output directory cannot be created, a record or the
 * id mapping cannot be written, a loaded mapping file cannot be parsed.
 * <p>
 * The operation that triggered it is aborted.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
