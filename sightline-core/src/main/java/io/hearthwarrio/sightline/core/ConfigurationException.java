package io.hearthwarrio.sightline.core;

/**
 * Thrown when an element query is configured in a way that can never produce a valid search:
 * unknown disposal policy, order index outside the occurrence cap, missing or unreadable template file.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
