package io.hearthwarrio.sightline.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Interval between visibility polls, optionally growing by a constant factor up to a ceiling.
 */
public final class PollingPolicy {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(1);

    public static final PollingPolicy DEFAULT = fixed(DEFAULT_INTERVAL);

    private final Duration initialInterval;
    private final double multiplier;
    private final Duration maxInterval;

    private PollingPolicy(Duration initialInterval, double multiplier, Duration maxInterval) {
        this.initialInterval = initialInterval;
        this.multiplier = multiplier;
        this.maxInterval = maxInterval;
    }

    public static PollingPolicy fixed(Duration interval) {
        checkPositive(interval, "interval");
        return new PollingPolicy(interval, 1.0, interval);
    }

    /**
     * @param multiplier  factor applied to the interval after every poll, {@code >= 1}
     * @param maxInterval ceiling for the grown interval
     */
    public static PollingPolicy backoff(Duration initialInterval, double multiplier, Duration maxInterval) {
        checkPositive(initialInterval, "initialInterval");
        checkPositive(maxInterval, "maxInterval");
        if (multiplier < 1.0 || Double.isNaN(multiplier)) {
            throw new IllegalArgumentException("multiplier must be >= 1, got " + multiplier);
        }
        if (maxInterval.compareTo(initialInterval) < 0) {
            throw new IllegalArgumentException("maxInterval must not be shorter than initialInterval");
        }
        return new PollingPolicy(initialInterval, multiplier, maxInterval);
    }

    public Duration getInitialInterval() {
        return initialInterval;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getMaxInterval() {
        return maxInterval;
    }

    /**
     * Interval to use after {@code current}.
     */
    public Duration next(Duration current) {
        if (multiplier == 1.0) {
            return current;
        }
        long grown = (long) Math.min(current.toNanos() * multiplier, (double) maxInterval.toNanos());
        return Duration.ofNanos(grown);
    }

    private static void checkPositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + d);
        }
    }

    @Override
    public String toString() {
        return "PollingPolicy{" +
                "initialInterval=" + initialInterval +
                ", multiplier=" + multiplier +
                ", maxInterval=" + maxInterval +
                '}';
    }
}
