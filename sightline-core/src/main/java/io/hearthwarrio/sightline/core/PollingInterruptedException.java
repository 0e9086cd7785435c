package io.hearthwarrio.sightline.core;

/**
 * Thrown when a thread blocked in a visibility wait is interrupted.
 * The interrupt flag is restored before this is thrown.
 */
public class PollingInterruptedException extends RuntimeException {
    public PollingInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
