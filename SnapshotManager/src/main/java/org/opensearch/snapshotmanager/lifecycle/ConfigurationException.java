package org.opensearch.snapshotmanager.lifecycle;

/**
 * The run settings are missing or malformed; raised before any request is made.
 */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
