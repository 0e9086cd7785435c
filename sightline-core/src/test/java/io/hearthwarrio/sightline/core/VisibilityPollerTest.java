package io.hearthwarrio.sightline.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

public class VisibilityPollerTest {

    private final ManualClock clock = new ManualClock();
    private final VisibilityPoller poller = new VisibilityPoller(clock, clock, PollingPolicy.DEFAULT);

    private static final Match SOME_MATCH = new Match(10, 10, 4, 4, 0.9);

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private Supplier<SearchResult> visibleFrom(int tick, AtomicInteger calls) {
        return () -> {
            int n = calls.getAndIncrement();
            return n >= tick
                    ? new SearchResult("ok", List.of(SOME_MATCH), clock.instant())
                    : SearchResult.empty("ok", clock.instant());
        };
    }

    @Test
    void neverAppearingElementTimesOutAfterTimeoutButBeforeOneMoreInterval() {
        Instant start = clock.instant();
        AtomicInteger calls = new AtomicInteger();

        NotFoundTimeoutException ex = assertThrows(NotFoundTimeoutException.class,
                () -> poller.awaitVisible("ok", visibleFrom(Integer.MAX_VALUE, calls), Duration.ofSeconds(2)));

        Duration elapsed = Duration.between(start, clock.instant());
        assertTrue(elapsed.compareTo(Duration.ofSeconds(2)) >= 0, "elapsed " + elapsed);
        assertTrue(elapsed.compareTo(Duration.ofSeconds(3)) < 0, "elapsed " + elapsed);
        assertEquals(3, calls.get());
        assertEquals("ok", ex.getElementName());
        assertEquals(Duration.ofSeconds(2), ex.getTimeout());
        assertTrue(ex.getMessage().contains("\"ok\""));
        assertTrue(ex.getMessage().contains("2 seconds"));
    }

    @Test
    void returnsAsSoonAsTheElementAppears() {
        AtomicInteger calls = new AtomicInteger();

        SearchResult result = poller.awaitVisible("ok", visibleFrom(2, calls), Duration.ofSeconds(10));

        assertTrue(result.isVisible());
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1)), clock.sleeps());
    }

    @Test
    void zeroTimeoutStillSearchesOnce() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(NotFoundTimeoutException.class,
                () -> poller.awaitVisible("ok", visibleFrom(1, calls), Duration.ZERO));
        assertEquals(1, calls.get());
        assertTrue(clock.sleeps().isEmpty());
    }

    @Test
    void waitsForDisappearance() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<SearchResult> goneOnThirdCall = () -> calls.getAndIncrement() < 2
                ? new SearchResult("ok", List.of(SOME_MATCH), clock.instant())
                : SearchResult.empty("ok", clock.instant());

        SearchResult result = poller.awaitNotVisible("ok", goneOnThirdCall, Duration.ofSeconds(10));

        assertFalse(result.isVisible());
        assertEquals(3, calls.get());
    }

    @Test
    void stillPresentElementTimesOut() {
        AtomicInteger calls = new AtomicInteger();

        StillPresentTimeoutException ex = assertThrows(StillPresentTimeoutException.class,
                () -> poller.awaitNotVisible("ok", visibleFrom(0, calls), Duration.ofSeconds(3)));

        assertTrue(ex.getMessage().startsWith("Still present \"ok\""));
        assertEquals(4, calls.get());
    }

    @Test
    void backoffGrowsIntervalUpToTheCeilingAndNeverSleepsPastTheTimeout() {
        PollingPolicy backoff = PollingPolicy.backoff(Duration.ofMillis(100), 2.0, Duration.ofMillis(500));
        VisibilityPoller p = new VisibilityPoller(clock, clock, backoff);

        assertThrows(NotFoundTimeoutException.class,
                () -> p.awaitVisible("ok", visibleFrom(Integer.MAX_VALUE, new AtomicInteger()), Duration.ofMillis(1600)));

        assertEquals(List.of(
                Duration.ofMillis(100),
                Duration.ofMillis(200),
                Duration.ofMillis(400),
                Duration.ofMillis(500),
                Duration.ofMillis(400)
        ), clock.sleeps());
    }

    @Test
    void slowSearchesCountAgainstTheTimeout() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<SearchResult> slow = () -> {
            calls.incrementAndGet();
            clock.advance(Duration.ofMillis(700));
            return SearchResult.empty("ok", clock.instant());
        };

        assertThrows(NotFoundTimeoutException.class, () -> poller.awaitVisible("ok", slow, Duration.ofSeconds(2)));

        assertEquals(2, calls.get());
    }

    @Test
    void interruptionAbortsTheWaitAndKeepsTheFlag() {
        Sleeper interrupted = d -> {
            throw new InterruptedException("stop");
        };
        VisibilityPoller p = new VisibilityPoller(clock, interrupted, PollingPolicy.DEFAULT);

        assertThrows(PollingInterruptedException.class,
                () -> p.awaitVisible("ok", visibleFrom(5, new AtomicInteger()), Duration.ofSeconds(10)));
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void policyRejectsNonPositiveIntervals() {
        assertThrows(IllegalArgumentException.class, () -> PollingPolicy.fixed(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> PollingPolicy.backoff(Duration.ofSeconds(1), 0.5, Duration.ofSeconds(2)));
        assertThrows(IllegalArgumentException.class,
                () -> PollingPolicy.backoff(Duration.ofSeconds(2), 2.0, Duration.ofSeconds(1)));
    }
}
