package io.hearthwarrio.sightline.webdriver;

import io.hearthwarrio.sightline.core.ElementQuery;
import io.hearthwarrio.sightline.core.Match;
import io.hearthwarrio.sightline.core.SearchListener;
import io.hearthwarrio.sightline.core.SearchResult;

import java.util.Objects;

/**
 * Bridges element events to a {@link MatchLogger}.
 */
final class LoggingSearchListener implements SearchListener {

    private final MatchLogger logger;

    LoggingSearchListener(MatchLogger logger) {
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    @Override
    public void onSearch(ElementQuery query, SearchResult result) {
        logger.logSearch(query.getName(), query, result);
    }

    @Override
    public void onActivate(ElementQuery query, Match match) {
        logger.logTap(query.getName(), match);
    }
}
