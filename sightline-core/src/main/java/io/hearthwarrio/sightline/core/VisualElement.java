package io.hearthwarrio.sightline.core;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A template-defined UI element bound to a screen and a tap dispatcher.
 * <p>
 * Caching behavior:
 * <ul>
 *   <li>{@link #matches()}, {@link #size()}, {@link #matchAt(int)}, {@link #match()} and iteration reuse the last
 *       {@link SearchResult} until {@link #invalidate()} is called.</li>
 *   <li>{@link #search()}, {@link #isVisible()} and the waits always capture the screen again and replace the
 *       cached result.</li>
 * </ul>
 * The cached result is an immutable value swapped atomically; the element itself is meant for a single thread.
 */
public class VisualElement implements Iterable<Match> {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final VisualSearchEngine engine;
    private final ScreenSource screen;
    private final TapDispatcher dispatcher;
    private final VisibilityPoller poller;
    private final SearchListener listener;

    private volatile ElementQuery query;
    private volatile SearchResult cached;

    public VisualElement(ElementQuery query, VisualSearchEngine engine, ScreenSource screen, TapDispatcher dispatcher) {
        this(query, engine, screen, dispatcher, new VisibilityPoller(), SearchListener.NONE);
    }

    public VisualElement(
            ElementQuery query,
            VisualSearchEngine engine,
            ScreenSource screen,
            TapDispatcher dispatcher,
            VisibilityPoller poller,
            SearchListener listener
    ) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.screen = Objects.requireNonNull(screen, "screen must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.poller = Objects.requireNonNull(poller, "poller must not be null");
        this.listener = listener == null ? SearchListener.NONE : listener;
    }

    public ElementQuery getQuery() {
        return query;
    }

    public String getName() {
        return query.getName();
    }

    /**
     * Enables or disables debug image output for the following searches.
     */
    public VisualElement debug(boolean enable) {
        this.query = query.withDebug(enable);
        return this;
    }

    public VisualElement debug() {
        return debug(true);
    }

    /**
     * Drops the cached result; the next read searches again.
     */
    public VisualElement invalidate() {
        this.cached = null;
        return this;
    }

    /**
     * Captures the screen and searches now, replacing the cached result.
     */
    public SearchResult search() {
        invalidate();
        ElementQuery q = query;
        SearchResult result = engine.search(q, screen.capture());
        listener.onSearch(q, result);
        this.cached = result;
        return result;
    }

    /**
     * @return the cached result, searching first if there is none
     */
    public SearchResult result() {
        SearchResult r = cached;
        return r != null ? r : search();
    }

    /**
     * @return the cached result without searching
     */
    public Optional<SearchResult> lastResult() {
        return Optional.ofNullable(cached);
    }

    public List<Match> matches() {
        return result().matches();
    }

    public int size() {
        return result().size();
    }

    /**
     * @throws MatchIndexOutOfRangeException if fewer than {@code index + 1} occurrences were found
     */
    public Match matchAt(int index) {
        return result().get(index);
    }

    /**
     * @return the match at the configured order index
     */
    public Match match() {
        return matchAt(query.getOrderIndex());
    }

    @Override
    public Iterator<Match> iterator() {
        return result().iterator();
    }

    /**
     * Always searches again.
     */
    public boolean isVisible() {
        return search().isVisible();
    }

    public VisualElement waitUntilVisible() {
        return waitUntilVisible(DEFAULT_TIMEOUT);
    }

    /**
     * @throws NotFoundTimeoutException if the element does not appear within {@code timeout}
     */
    public VisualElement waitUntilVisible(Duration timeout) {
        poller.awaitVisible(getName(), this::search, timeout);
        return this;
    }

    public VisualElement waitUntilNotVisible() {
        return waitUntilNotVisible(DEFAULT_TIMEOUT);
    }

    /**
     * @throws StillPresentTimeoutException if the element is still on screen after {@code timeout}
     */
    public VisualElement waitUntilNotVisible(Duration timeout) {
        poller.awaitNotVisible(getName(), this::search, timeout);
        return this;
    }

    /**
     * Same as {@link #waitUntilVisible(Duration)}: a visible template is considered clickable.
     */
    public VisualElement waitUntilClickable(Duration timeout) {
        return waitUntilVisible(timeout);
    }

    public VisualElement click() {
        return click(DEFAULT_TIMEOUT);
    }

    /**
     * Waits for the element and taps the match at the configured order index.
     *
     * @throws NotFoundTimeoutException      if the element does not appear within {@code timeout}
     * @throws MatchIndexOutOfRangeException if fewer occurrences than the order index were found
     */
    public VisualElement click(Duration timeout) {
        waitUntilClickable(timeout);
        Match m = match();
        MatchActions.activate(m, dispatcher);
        listener.onActivate(query, m);
        return this;
    }

    @Override
    public String toString() {
        return "VisualElement{" +
                "query=" + query +
                ", cached=" + cached +
                '}';
    }
}
