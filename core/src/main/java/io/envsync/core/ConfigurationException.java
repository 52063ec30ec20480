// file: core/src/main/java/io/envsync/core/ConfigurationException.java
package io.envsync.core;

/**
 * Invalid command line, missing or unsupported org configuration.
 * Reported to the user as a usage error; nothing has been touched yet.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
