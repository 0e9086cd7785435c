package io.hearthwarrio.sightline.testkit;

import io.hearthwarrio.sightline.core.PollingPolicy;
import io.hearthwarrio.sightline.webdriver.MatchLogDetail;
import io.hearthwarrio.sightline.webdriver.SightlineWebDriver;
import io.hearthwarrio.sightline.webdriver.WebDriverTapDispatcher;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.interactions.PointerInput;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Convenience factory methods for creating Sightline instances in tests.
 * <p>
 * Keeps test code minimal and consistent.
 * Does not depend on Allure.
 */
public final class TestSightline {

    /**
     * Polls faster than the production default to keep test suites short.
     */
    public static final PollingPolicy TEST_POLLING = PollingPolicy.fixed(Duration.ofMillis(250));

    private TestSightline() {
        // utility class
    }

    /**
     * Creates a plain SightlineWebDriver without logging, reading templates from {@code templates}.
     */
    public static SightlineWebDriver plain(WebDriver driver, Path templates) {
        Objects.requireNonNull(driver, "driver must not be null");
        Objects.requireNonNull(templates, "templates must not be null");
        return new SightlineWebDriver(driver)
                .withTemplateDirectory(templates)
                .withPollingPolicy(TEST_POLLING);
    }

    /**
     * Creates a SightlineWebDriver with stdout match logging enabled.
     */
    public static SightlineWebDriver stdout(WebDriver driver, Path templates, MatchLogDetail detail) {
        return plain(driver, templates)
                .withLoggingToStdOut(detail);
    }

    /**
     * Desktop browsers: clicks with a mouse pointer instead of a touch pointer.
     */
    public static SightlineWebDriver desktop(WebDriver driver, Path templates, MatchLogDetail detail) {
        return stdout(driver, templates, detail)
                .withTapDispatcher(new WebDriverTapDispatcher(
                        driver, PointerInput.Kind.MOUSE, 1.0));
    }
}
