package io.hearthwarrio.sightline.core;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stateless search: one screen, one {@link ElementQuery}, one {@link SearchResult}.
 * <p>
 * For every template variant the query resolves to, runs the scale pyramid search and occurrence
 * extraction independently, then orders the union once and caps it at the query's maximum occurrences.
 * Safe to share between elements and threads as long as its collaborators are.
 */
public class VisualSearchEngine {

    private final ScalePyramidSearcher pyramidSearcher;
    private final OccurrenceExtractor extractor;
    private final TemplateResolver templateResolver;
    private final TemplateLoader templateLoader;
    private final SearchObserver debugObserver;
    private final Clock clock;

    public VisualSearchEngine(
            CorrelationPrimitive correlation,
            ImageProcessor processor,
            TemplateResolver templateResolver
    ) {
        this(
                new ScalePyramidSearcher(correlation, processor),
                new OccurrenceExtractor(correlation),
                templateResolver,
                new TemplateLoader(processor),
                SearchObserver.NONE,
                Clock.systemUTC()
        );
    }

    /**
     * @param debugObserver receives intermediate images for queries with debug enabled
     */
    public VisualSearchEngine(
            ScalePyramidSearcher pyramidSearcher,
            OccurrenceExtractor extractor,
            TemplateResolver templateResolver,
            TemplateLoader templateLoader,
            SearchObserver debugObserver,
            Clock clock
    ) {
        this.pyramidSearcher = Objects.requireNonNull(pyramidSearcher, "pyramidSearcher must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.templateResolver = Objects.requireNonNull(templateResolver, "templateResolver must not be null");
        this.templateLoader = Objects.requireNonNull(templateLoader, "templateLoader must not be null");
        this.debugObserver = Objects.requireNonNull(debugObserver, "debugObserver must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return ranked matches; empty when the element is not on screen
     * @throws ConfigurationException if the query is invalid or names a missing/unreadable template,
     *                                regardless of what is on screen
     */
    public SearchResult search(ElementQuery query, GrayImage screen) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(screen, "screen must not be null");

        query.validate();

        String name = query.getName();
        SearchObserver observer = query.isDebug() ? debugObserver : SearchObserver.NONE;
        observer.onScreen(name, screen);

        List<Path> templates = templateResolver.resolve(query.getTemplateSource());

        List<Match> all = new ArrayList<>();
        for (Path templatePath : templates) {
            GrayImage template = templateLoader.load(templatePath);
            all.addAll(searchTemplate(query, screen, template, templatePath.toString(), observer));
        }

        List<Match> ordered = MatchOrderer.order(all, query.getDisposalPolicy());
        if (ordered.size() > query.getMaxOccurrences()) {
            ordered = new ArrayList<>(ordered.subList(0, query.getMaxOccurrences()));
        }

        return new SearchResult(name, ordered, clock.instant());
    }

    /**
     * Scale pyramid search plus occurrence extraction for a single, already loaded template.
     */
    public List<Match> searchTemplate(
            ElementQuery query,
            GrayImage screen,
            GrayImage template,
            String templatePath,
            SearchObserver observer
    ) {
        String name = query.getName();
        Optional<ScaledPeak> best = pyramidSearcher.search(
                screen,
                template,
                query.getSimilarityThreshold(),
                query.getMethod(),
                name,
                observer
        );
        if (best.isEmpty()) {
            return List.of();
        }

        List<Match> matches = extractor.extract(
                best.get(),
                template,
                query.getSimilarityThreshold(),
                query.getMethod(),
                query.getMaxOccurrences(),
                templatePath,
                name,
                observer
        );
        observer.onTemplateMatches(name, screen, matches);
        return matches;
    }
}
