package io.hearthwarrio.sightline.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Re-runs a search until the element becomes visible (or stops being visible) or the timeout elapses.
 * <p>
 * Every tick runs a fresh search. The first tick happens immediately, so a zero timeout still searches once.
 * Blocks the calling thread; interrupting it aborts the wait with {@link PollingInterruptedException}.
 */
public class VisibilityPoller {

    private enum State {
        POLLING, FOUND, TIMED_OUT
    }

    private final Clock clock;
    private final Sleeper sleeper;
    private final PollingPolicy policy;

    public VisibilityPoller() {
        this(Clock.systemUTC(), Sleeper.SYSTEM, PollingPolicy.DEFAULT);
    }

    public VisibilityPoller(PollingPolicy policy) {
        this(Clock.systemUTC(), Sleeper.SYSTEM, policy);
    }

    public VisibilityPoller(Clock clock, Sleeper sleeper, PollingPolicy policy) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public PollingPolicy getPolicy() {
        return policy;
    }

    /**
     * @return the first result that has at least one match
     * @throws NotFoundTimeoutException if no such result was seen within {@code timeout}
     */
    public SearchResult awaitVisible(String elementName, Supplier<SearchResult> search, Duration timeout) {
        SearchResult last = await(search, timeout, SearchResult::isVisible);
        if (last == null) {
            throw new NotFoundTimeoutException(elementName, timeout);
        }
        return last;
    }

    /**
     * @return the first result without matches
     * @throws StillPresentTimeoutException if every result within {@code timeout} still had matches
     */
    public SearchResult awaitNotVisible(String elementName, Supplier<SearchResult> search, Duration timeout) {
        SearchResult last = await(search, timeout, r -> !r.isVisible());
        if (last == null) {
            throw new StillPresentTimeoutException(elementName, timeout);
        }
        return last;
    }

    /**
     * @return the result satisfying {@code done}, or null on timeout
     */
    private SearchResult await(Supplier<SearchResult> search, Duration timeout, Predicate<SearchResult> done) {
        Objects.requireNonNull(search, "search must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        Instant start = clock.instant();
        Duration interval = policy.getInitialInterval();
        State state = State.POLLING;
        SearchResult result = null;

        while (state == State.POLLING) {
            result = search.get();
            if (done.test(result)) {
                state = State.FOUND;
                continue;
            }

            Duration elapsed = Duration.between(start, clock.instant());
            if (elapsed.compareTo(timeout) >= 0) {
                state = State.TIMED_OUT;
                continue;
            }

            Duration remaining = timeout.minus(elapsed);
            sleep(interval.compareTo(remaining) < 0 ? interval : remaining);
            interval = policy.next(interval);
        }

        return state == State.FOUND ? result : null;
    }

    private void sleep(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PollingInterruptedException("Interrupted while waiting for visibility", e);
        }
    }
}
