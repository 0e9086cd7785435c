package io.hearthwarrio.sightline.core;

import java.util.List;

/**
 * Diagnostic side channel of a search: receives intermediate images.
 * <p>
 * Purely observational: the search result never depends on an observer.
 * Only consulted for queries with debug enabled. Exceptions thrown by an observer are not caught and
 * abort the search, so a debug dump that cannot be written fails loudly instead of disappearing.
 */
public interface SearchObserver {

    SearchObserver NONE = new SearchObserver() {
    };

    /**
     * The captured screen, before any template is processed.
     */
    default void onScreen(String elementName, GrayImage screen) {
    }

    /**
     * A scale whose best score cleared the threshold.
     *
     * @param resized  source resized to this scale
     * @param peak     best alignment in {@code resized}
     * @param template template being searched
     */
    default void onScaleCandidate(String elementName, GrayImage resized, Peak peak, GrayImage template) {
    }

    /**
     * The resized image after the {@code iteration}-th matched region was blanked.
     */
    default void onCovered(String elementName, int iteration, GrayImage covered) {
    }

    /**
     * All occurrences extracted for one template variant, in source-image coordinates.
     */
    default void onTemplateMatches(String elementName, GrayImage screen, List<Match> matches) {
    }
}
