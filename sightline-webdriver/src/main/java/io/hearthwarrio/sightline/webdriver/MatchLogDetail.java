package io.hearthwarrio.sightline.webdriver;

/**
 * Controls how much of a search result should be logged.
 */
public enum MatchLogDetail {

    /**
     * Element name and match count only.
     */
    NONE,

    /**
     * Also the first ranked match.
     */
    BEST,

    /**
     * Every match with its geometry, similarity and template path.
     */
    ALL
}
