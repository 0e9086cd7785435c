package io.hearthwarrio.sightline.webdriver;

import io.hearthwarrio.sightline.core.*;
import io.hearthwarrio.sightline.opencv.DebugImageWriter;
import io.hearthwarrio.sightline.opencv.OpenCvCorrelationPrimitive;
import io.hearthwarrio.sightline.opencv.OpenCvImageProcessor;
import org.openqa.selenium.WebDriver;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * High-level Sightline entry point for Selenium and Appium drivers.
 * <p>
 * Elements are described by template images, captured through {@link org.openqa.selenium.TakesScreenshot}
 * and tapped through W3C actions. Each {@link #element(String)} call snapshots the current configuration;
 * later {@code with*} calls affect only elements created afterwards.
 */
public class SightlineWebDriver {

    private final WebDriver driver;
    private final CorrelationPrimitive correlation;
    private final ImageProcessor processor;
    private final ScreenSource screenSource;

    private TapDispatcher tapDispatcher;
    private ScalePyramid pyramid = ScalePyramid.defaultPyramid();
    private Path templateDirectory = Paths.get("");
    private SearchObserver debugObserver = SearchObserver.NONE;
    private PollingPolicy pollingPolicy = PollingPolicy.DEFAULT;

    /**
     * Mutable to support runtime overrides and DSL sugar.
     */
    private MatchLogger matchLogger;

    public SightlineWebDriver(WebDriver driver) {
        this(driver, new OpenCvCorrelationPrimitive(), new OpenCvImageProcessor());
    }

    public SightlineWebDriver(WebDriver driver, MatchLogger logger) {
        this(driver);
        this.matchLogger = logger;
    }

    public SightlineWebDriver(WebDriver driver, CorrelationPrimitive correlation, ImageProcessor processor) {
        this(driver, correlation, processor, new WebDriverScreenSource(driver, processor), new WebDriverTapDispatcher(driver));
    }

    public SightlineWebDriver(
            WebDriver driver,
            CorrelationPrimitive correlation,
            ImageProcessor processor,
            ScreenSource screenSource,
            TapDispatcher tapDispatcher
    ) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.correlation = Objects.requireNonNull(correlation, "correlation must not be null");
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.screenSource = Objects.requireNonNull(screenSource, "screenSource must not be null");
        this.tapDispatcher = Objects.requireNonNull(tapDispatcher, "tapDispatcher must not be null");
    }

    // ----------- configuration (low-level) -----------

    public SightlineWebDriver withLogger(MatchLogger logger) {
        this.matchLogger = logger;
        return this;
    }

    public SightlineWebDriver withLoggingToStdOut(MatchLogDetail detail) {
        this.matchLogger = new StdOutMatchLogger(detail);
        return this;
    }

    public SightlineWebDriver withPyramid(ScalePyramid pyramid) {
        this.pyramid = Objects.requireNonNull(pyramid, "pyramid must not be null");
        return this;
    }

    /**
     * Relative template paths and patterns are resolved against this directory.
     */
    public SightlineWebDriver withTemplateDirectory(Path templateDirectory) {
        this.templateDirectory = Objects.requireNonNull(templateDirectory, "templateDirectory must not be null");
        return this;
    }

    /**
     * Debug images of elements with debug enabled are written as PNG files to {@code directory}.
     */
    public SightlineWebDriver withDebugDirectory(Path directory) {
        return withDebugObserver(new DebugImageWriter(directory));
    }

    public SightlineWebDriver withDebugObserver(SearchObserver observer) {
        this.debugObserver = Objects.requireNonNull(observer, "observer must not be null");
        return this;
    }

    public SightlineWebDriver withPollingPolicy(PollingPolicy policy) {
        this.pollingPolicy = Objects.requireNonNull(policy, "policy must not be null");
        return this;
    }

    public SightlineWebDriver withTapDispatcher(TapDispatcher dispatcher) {
        this.tapDispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        return this;
    }

    // ----------- configuration (sugar, minimal set) -----------

    public SightlineWebDriver logMatches() {
        return withLoggingToStdOut(MatchLogDetail.ALL);
    }

    public SightlineWebDriver disableMatchLogging() {
        this.matchLogger = null;
        return this;
    }

    /**
     * Dumps debug images to {@link DebugImageWriter#DEFAULT_DIRECTORY}.
     */
    public SightlineWebDriver debugToDefaultDirectory() {
        return withDebugDirectory(DebugImageWriter.DEFAULT_DIRECTORY);
    }

    public WebDriver getDriver() {
        return driver;
    }

    public ScalePyramid getPyramid() {
        return pyramid;
    }

    public PollingPolicy getPollingPolicy() {
        return pollingPolicy;
    }

    MatchLogger getMatchLogger() {
        return matchLogger;
    }

    // ----------- main API -----------

    /**
     * Creates an element for a template path or glob pattern, e.g. {@code "buttons/ok*.png"}.
     *
     * @throws ConfigurationException if {@code templateSource} is null or blank
     */
    public VisualElement element(String templateSource) {
        return element(ElementQuery.of(templateSource));
    }

    public VisualElement element(ElementQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        return new VisualElement(
                query,
                newEngine(),
                screenSource,
                tapDispatcher,
                new VisibilityPoller(pollingPolicy),
                matchLogger == null ? SearchListener.NONE : new LoggingSearchListener(matchLogger)
        );
    }

    /**
     * Captures the screen and searches once.
     */
    public SearchResult search(String templateSource) {
        return element(templateSource).search();
    }

    public boolean isVisible(String templateSource) {
        return element(templateSource).isVisible();
    }

    /**
     * Waits up to {@link VisualElement#DEFAULT_TIMEOUT} and taps the best ranked match.
     */
    public void click(String templateSource) {
        element(templateSource).click();
    }

    public void click(String templateSource, Duration timeout) {
        element(templateSource).click(timeout);
    }

    VisualSearchEngine newEngine() {
        return new VisualSearchEngine(
                new ScalePyramidSearcher(correlation, processor, pyramid),
                new OccurrenceExtractor(correlation),
                new GlobTemplateResolver(templateDirectory),
                new TemplateLoader(processor),
                debugObserver,
                Clock.systemUTC()
        );
    }
}
