package io.hearthwarrio.sightline.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class VisualSearchEngineTest {

    @TempDir
    Path dir;

    private final JavaVision vision = new JavaVision();
    private final GrayImage okTemplate = TestImages.noise(12, 12, 21);
    private final GrayImage okDarkTemplate = TestImages.noise(12, 12, 22);

    private VisualSearchEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        TestImages.writePgm(dir.resolve("ok.pgm"), okTemplate);
        TestImages.writePgm(dir.resolve("variants/ok_light.pgm"), okTemplate);
        TestImages.writePgm(dir.resolve("variants/ok_dark.pgm"), okDarkTemplate);
        engine = new VisualSearchEngine(vision, vision, new GlobTemplateResolver(dir));
    }

    @Test
    void templatePresentOnceYieldsExactlyOneMatch() {
        GrayImage noisy = TestImages.perturb(okTemplate, 20, 5);
        GrayImage screen = TestImages.blank(120, 60).withPatch(40, 24, noisy);

        SearchResult result = engine.search(ElementQuery.of("ok.pgm"), screen);

        assertEquals(1, result.size());
        Match m = result.first();
        assertTrue(m.getSimilarity() > 0.9 && m.getSimilarity() < 0.995, "similarity " + m.getSimilarity());
        assertEquals(46, m.getCenterX());
        assertEquals(30, m.getCenterY());
        assertEquals("ok", result.getElementName());
        assertTrue(m.getTemplatePath().endsWith("ok.pgm"));
    }

    @Test
    void absentTemplateIsAnEmptyResultNotAnError() {
        GrayImage screen = TestImages.blank(120, 60).withPatch(40, 24, TestImages.noise(12, 12, 500));

        SearchResult result = engine.search(ElementQuery.of("ok.pgm"), screen);

        assertFalse(result.isVisible());
        assertTrue(result.matches().isEmpty());
    }

    @Test
    void sideBySideCopiesComeBackLeftToRight() {
        GrayImage screen = TestImages.blank(160, 40)
                .withPatch(110, 14, okTemplate)
                .withPatch(10, 14, okTemplate)
                .withPatch(60, 14, okTemplate);

        SearchResult result = engine.search(
                ElementQuery.of("ok.pgm").withDisposal(DisposalPolicy.BY_HORIZONTAL_ASC), screen);

        assertEquals(3, result.size());
        for (int i = 1; i < result.size(); i++) {
            assertTrue(result.get(i - 1).getCenterX() <= result.get(i).getCenterX());
        }
        assertEquals(16, result.get(0).getCenterX());
        assertEquals(116, result.get(2).getCenterX());
    }

    @Test
    void confidenceOrderIsNonIncreasing() {
        GrayImage screen = TestImages.blank(160, 40)
                .withPatch(10, 14, TestImages.perturb(okTemplate, 40, 1))
                .withPatch(60, 14, okTemplate)
                .withPatch(110, 14, TestImages.perturb(okTemplate, 20, 2));

        SearchResult result = engine.search(ElementQuery.of("ok.pgm"), screen);

        assertEquals(3, result.size());
        for (int i = 1; i < result.size(); i++) {
            assertTrue(result.get(i - 1).getSimilarity() >= result.get(i).getSimilarity());
        }
        assertEquals(66, result.first().getCenterX());
    }

    @Test
    void raisingTheThresholdNeverAddsMatches() {
        GrayImage screen = TestImages.blank(200, 40)
                .withPatch(10, 14, okTemplate)
                .withPatch(60, 14, TestImages.perturb(okTemplate, 20, 3))
                .withPatch(110, 14, TestImages.perturb(okTemplate, 50, 4))
                .withPatch(160, 14, TestImages.perturb(okTemplate, 80, 5));

        int previous = Integer.MAX_VALUE;
        for (double threshold : new double[]{0.3, 0.5, 0.7, 0.9, 0.97, 0.999}) {
            int count = engine.search(ElementQuery.of("ok.pgm").withSimilarity(threshold), screen).size();
            assertTrue(count <= previous, "threshold " + threshold + " gave " + count + " > " + previous);
            previous = count;
        }
    }

    @Test
    void neverReturnsMoreThanMaxOccurrences() {
        GrayImage screen = TestImages.blank(200, 40);
        for (int x = 2; x + 12 <= 200; x += 20) {
            screen = screen.withPatch(x, 14, okTemplate);
        }

        for (int max : new int[]{1, 2, 5, 16}) {
            SearchResult result = engine.search(ElementQuery.of("ok.pgm").withMaxOccurrences(max), screen);
            assertTrue(result.size() <= max, max + " -> " + result.size());
        }
        assertEquals(5, engine.search(ElementQuery.of("ok.pgm").withMaxOccurrences(5), screen).size());
    }

    @Test
    void unionsAllTemplateVariants() {
        GrayImage screen = TestImages.blank(160, 40)
                .withPatch(10, 14, okTemplate)
                .withPatch(110, 14, okDarkTemplate);

        SearchResult result = engine.search(
                ElementQuery.of("variants/ok_*.pgm").withDisposal(DisposalPolicy.BY_HORIZONTAL_ASC), screen);

        assertEquals(2, result.size());
        assertTrue(result.get(0).getTemplatePath().endsWith("ok_light.pgm"));
        assertTrue(result.get(1).getTemplatePath().endsWith("ok_dark.pgm"));
        assertEquals("ok__", result.getElementName());
    }

    @Test
    void capAppliesToTheUnionOfVariants() {
        GrayImage screen = TestImages.blank(160, 40)
                .withPatch(10, 14, okTemplate)
                .withPatch(60, 14, okTemplate)
                .withPatch(110, 14, okDarkTemplate);

        SearchResult result = engine.search(
                ElementQuery.of("variants/ok_*.pgm").withMaxOccurrences(2), screen);

        assertEquals(2, result.size());
    }

    @Test
    void emptyPatternYieldsNoMatches() {
        SearchResult result = engine.search(ElementQuery.of("variants/cancel_*.pgm"), TestImages.blank(50, 50));

        assertFalse(result.isVisible());
    }

    @Test
    void missingLiteralTemplateIsAConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> engine.search(ElementQuery.of("missing.pgm"), TestImages.blank(50, 50)));
    }

    @Test
    void undecodableTemplateIsAConfigurationError() throws IOException {
        Files.writeString(dir.resolve("broken.pgm"), "not an image");

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> engine.search(ElementQuery.of("broken.pgm"), TestImages.blank(50, 50)));
        assertTrue(ex.getMessage().contains("broken.pgm"));
    }

    @Test
    void invalidConfigurationFailsEvenWhenNothingWouldMatch() {
        GrayImage screen = TestImages.blank(50, 50);

        assertThrows(ConfigurationException.class,
                () -> engine.search(ElementQuery.of("variants/none_*.pgm").withOrderIndex(16), screen));
        assertThrows(ConfigurationException.class,
                () -> engine.search(ElementQuery.of("variants/none_*.pgm").withDisposal(null), screen));
    }

    @Test
    void debugObserverOnlySeesDebugQueries() {
        List<String> events = new ArrayList<>();
        SearchObserver observer = new SearchObserver() {
            @Override
            public void onScreen(String elementName, GrayImage screen) {
                events.add("screen:" + elementName);
            }

            @Override
            public void onTemplateMatches(String elementName, GrayImage screen, List<Match> matches) {
                events.add("all:" + matches.size());
            }
        };
        VisualSearchEngine debugEngine = new VisualSearchEngine(
                new ScalePyramidSearcher(vision, vision),
                new OccurrenceExtractor(vision),
                new GlobTemplateResolver(dir),
                new TemplateLoader(vision),
                observer,
                Clock.systemUTC()
        );
        GrayImage screen = TestImages.blank(120, 60).withPatch(40, 24, okTemplate);

        debugEngine.search(ElementQuery.of("ok.pgm"), screen);
        assertTrue(events.isEmpty());

        debugEngine.search(ElementQuery.of("ok.pgm").withDebug(true), screen);
        assertEquals(List.of("screen:ok", "all:1"), events);
    }

    /**
     * Squared difference is lower-is-better, but it goes through the same "highest score above threshold"
     * rule as the correlation metrics. The perfect alignment (score 0) is therefore never reported.
     */
    @Test
    void squaredDifferenceIsRankedAsIfHigherWereBetter() {
        VisualSearchEngine nativeScale = new VisualSearchEngine(
                new ScalePyramidSearcher(vision, vision, ScalePyramid.nativeOnly()),
                new OccurrenceExtractor(vision),
                new GlobTemplateResolver(dir),
                new TemplateLoader(vision),
                SearchObserver.NONE,
                Clock.systemUTC()
        );
        GrayImage screen = TestImages.blank(120, 60).withPatch(40, 24, okTemplate);
        assertEquals(0.0, vision.correlate(screen, okTemplate, MatchMethod.SQDIFF_NORMED).get(40, 24), 1e-9);

        SearchResult result = nativeScale.search(
                ElementQuery.of("ok.pgm")
                        .withMethod(MatchMethod.SQDIFF_NORMED)
                        .withSimilarity(0.3)
                        .withMaxOccurrences(1),
                screen);

        assertTrue(MatchMethod.SQDIFF_NORMED.isLowerBetter());
        assertEquals(1, result.size());
        Match worst = result.first();
        assertTrue(worst.getSimilarity() > 0.3 && worst.getSimilarity() <= 1.0, "similarity " + worst.getSimilarity());
        assertFalse(worst.getLeft() == 40 && worst.getTop() == 24, "exact alignment reported: " + worst);
    }
}
