// file: core/src/main/java/io/envsync/core/BackendException.java
package io.envsync.core;

/**
 * A failed backend call: non-zero exit, non-2xx response, unparsable output.
 * <p>
 * Carries the resource type and command so the caller can log enough context
 * for manual remediation. {@link #alreadyExists()} is set when the backend
 * reported that the object exists in the target; callers still treat that as a
 * failure, they only log it differently.
 */
public class BackendException extends Exception {

    private final String resourceType;
    private final String command;
    private final boolean alreadyExists;

    public BackendException(String resourceType, String command, String message) {
        this(resourceType, command, message, false, null);
    }

    public BackendException(String resourceType, String command, String message, boolean alreadyExists,
                            Throwable cause) {
        super(resourceType + " " + command + ": " + message, cause);
        this.resourceType = resourceType;
        this.command = command;
        this.alreadyExists = alreadyExists;
    }

    public String resourceType() {
        return resourceType;
    }

    public String command() {
        return command;
    }

    public boolean alreadyExists() {
        return alreadyExists;
    }
}
