package io.hearthwarrio.sightline.core;

/**
 * Performs a tap (or click) at source-image pixel coordinates.
 */
@FunctionalInterface
public interface TapDispatcher {
    void tap(int x, int y);
}
