package io.hearthwarrio.sightline.allure;

import io.hearthwarrio.sightline.webdriver.MatchLogDetail;
import io.hearthwarrio.sightline.webdriver.MatchLogger;
import org.openqa.selenium.WebDriver;

/**
 * Factory methods for Allure-related Sightline loggers.
 * <p>
 * This class lives in the sightline-allure module to avoid leaking Allure
 * dependencies into sightline-core or sightline-webdriver.
 */
public final class SightlineAllureLoggers {

    private SightlineAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger that lists all matches without screenshots.
     */
    public static MatchLogger matches(WebDriver driver) {
        return new AllureMatchLogger(driver, MatchLogDetail.ALL, false);
    }

    /**
     * Creates an Allure logger with explicit detail and screenshot flag.
     */
    public static MatchLogger matches(WebDriver driver, MatchLogDetail detail, boolean screenshots) {
        return new AllureMatchLogger(driver, detail, screenshots);
    }
}
