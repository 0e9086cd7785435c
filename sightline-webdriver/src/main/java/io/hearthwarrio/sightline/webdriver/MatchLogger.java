package io.hearthwarrio.sightline.webdriver;

import io.hearthwarrio.sightline.core.ElementQuery;
import io.hearthwarrio.sightline.core.Match;
import io.hearthwarrio.sightline.core.SearchResult;

/**
 * Receives information about searches and taps.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 */
@FunctionalInterface
public interface MatchLogger {

    /**
     * Called after every completed search, including searches that found nothing.
     *
     * @param elementName name of the searched element
     * @param query       query the search ran with
     * @param result      ranked matches
     */
    void logSearch(String elementName, ElementQuery query, SearchResult result);

    /**
     * Called after a match was tapped.
     */
    default void logTap(String elementName, Match match) {
    }

    /**
     * Default is {@link MatchLogDetail#ALL} for lambda loggers.
     */
    default MatchLogDetail detail() {
        return MatchLogDetail.ALL;
    }
}
