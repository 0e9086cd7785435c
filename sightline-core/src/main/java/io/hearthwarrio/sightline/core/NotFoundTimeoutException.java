package io.hearthwarrio.sightline.core;

import java.time.Duration;

/**
 * The element did not appear within the timeout.
 */
public class NotFoundTimeoutException extends VisibilityTimeoutException {
    public NotFoundTimeoutException(String elementName, Duration timeout) {
        super("Cannot find \"" + elementName + "\" in " + seconds(timeout), elementName, timeout);
    }
}
