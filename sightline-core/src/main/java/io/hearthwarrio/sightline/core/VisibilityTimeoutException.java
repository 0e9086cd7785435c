package io.hearthwarrio.sightline.core;

import java.time.Duration;

/**
 * Thrown by {@link VisibilityPoller} when the awaited visibility state is not reached in time.
 */
public abstract class VisibilityTimeoutException extends RuntimeException {

    private final String elementName;
    private final Duration timeout;

    protected VisibilityTimeoutException(String message, String elementName, Duration timeout) {
        super(message);
        this.elementName = elementName;
        this.timeout = timeout;
    }

    public String getElementName() {
        return elementName;
    }

    public Duration getTimeout() {
        return timeout;
    }

    static String seconds(Duration timeout) {
        long millis = timeout.toMillis();
        if (millis % 1000 == 0) {
            return (millis / 1000) + " seconds";
        }
        return (millis / 1000.0) + " seconds";
    }
}
