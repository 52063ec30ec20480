// file: core/src/main/java/io/envsync/core/CatalogException.java
package io.envsync.core;

/**
 * Raised when a resource catalog is malformed: unresolved, self-referential or
 * chained dependencies, duplicate names, misplaced attributes.
 * <p>
 * Always fatal; nothing is traversed with a catalog that failed validation.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
