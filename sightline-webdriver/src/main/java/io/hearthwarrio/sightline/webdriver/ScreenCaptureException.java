package io.hearthwarrio.sightline.webdriver;

/**
 * Thrown when the driver cannot provide a decodable screenshot.
 */
public class ScreenCaptureException extends RuntimeException {

    public ScreenCaptureException(String message) {
        super(message);
    }

    public ScreenCaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
