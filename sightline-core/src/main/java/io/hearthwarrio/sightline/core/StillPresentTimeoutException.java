package io.hearthwarrio.sightline.core;

import java.time.Duration;

/**
 * The element was still on screen when the timeout elapsed.
 */
public class StillPresentTimeoutException extends VisibilityTimeoutException {
    public StillPresentTimeoutException(String elementName, Duration timeout) {
        super("Still present \"" + elementName + "\" after " + seconds(timeout), elementName, timeout);
    }
}
