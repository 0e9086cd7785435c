package io.hearthwarrio.sightline.core;

/**
 * Captures the current screen. Called once per search; failures propagate to the caller.
 */
@FunctionalInterface
public interface ScreenSource {
    GrayImage capture();
}
