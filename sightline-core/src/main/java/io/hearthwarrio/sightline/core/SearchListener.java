package io.hearthwarrio.sightline.core;

/**
 * Receives completed searches and activations of a {@link VisualElement}.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 */
@FunctionalInterface
public interface SearchListener {

    SearchListener NONE = (query, result) -> {
    };

    void onSearch(ElementQuery query, SearchResult result);

    default void onActivate(ElementQuery query, Match match) {
    }
}
