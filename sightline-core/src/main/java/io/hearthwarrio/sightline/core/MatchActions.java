package io.hearthwarrio.sightline.core;

import java.util.Objects;

/**
 * Actions on found matches.
 */
public final class MatchActions {

    private MatchActions() {
        // utility class
    }

    /**
     * Taps the center of the match.
     */
    public static void activate(Match match, TapDispatcher dispatcher) {
        Objects.requireNonNull(match, "match must not be null");
        Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        dispatcher.tap(match.getCenterX(), match.getCenterY());
    }
}
