package io.hearthwarrio.sightline.core;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Interruptible timed wait used between polls.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Keeps sub-millisecond remainders instead of truncating them to zero.
     */
    Sleeper SYSTEM = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

    void sleep(Duration duration) throws InterruptedException;
}
