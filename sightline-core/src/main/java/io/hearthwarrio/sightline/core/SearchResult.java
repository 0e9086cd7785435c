package io.hearthwarrio.sightline.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered outcome of one search for one element.
 * <p>
 * An empty result is a normal outcome: the element is simply not on screen.
 */
public final class SearchResult implements Iterable<Match> {

    private final String elementName;
    private final List<Match> matches;
    private final Instant capturedAt;

    public SearchResult(String elementName, List<Match> matches, Instant capturedAt) {
        this.elementName = Objects.requireNonNull(elementName, "elementName must not be null");
        this.matches = Collections.unmodifiableList(
                new ArrayList<>(Objects.requireNonNull(matches, "matches must not be null"))
        );
        this.capturedAt = Objects.requireNonNull(capturedAt, "capturedAt must not be null");
    }

    public static SearchResult empty(String elementName, Instant capturedAt) {
        return new SearchResult(elementName, Collections.emptyList(), capturedAt);
    }

    public String getElementName() {
        return elementName;
    }

    /**
     * @return ranked matches (read-only)
     */
    public List<Match> matches() {
        return matches;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    public int size() {
        return matches.size();
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    public boolean isVisible() {
        return !matches.isEmpty();
    }

    /**
     * @throws MatchIndexOutOfRangeException if fewer than {@code index + 1} matches were found
     */
    public Match get(int index) {
        if (index < 0 || index >= matches.size()) {
            throw new MatchIndexOutOfRangeException(elementName, index, matches.size());
        }
        return matches.get(index);
    }

    public Match first() {
        return get(0);
    }

    @Override
    public Iterator<Match> iterator() {
        return matches.iterator();
    }

    @Override
    public String toString() {
        return "SearchResult{" +
                "element='" + elementName + '\'' +
                ", matches=" + matches +
                ", capturedAt=" + capturedAt +
                '}';
    }
}
