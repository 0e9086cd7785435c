package io.hearthwarrio.sightline.testkit;

import org.openqa.selenium.Capabilities;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;

import java.net.URL;
import java.util.Objects;

/**
 * Minimal WebDriver factory for visual tests.
 * <p>
 * Screenshots are compared pixel by pixel, so every factory pins the window size and
 * the device scale factor instead of maximizing.
 */
public final class TestDrivers {

    public static final Dimension DEFAULT_WINDOW_SIZE = new Dimension(1280, 800);

    private TestDrivers() {
        // utility class
    }

    /**
     * Creates a local ChromeDriver with default settings.
     */
    public static WebDriver chrome() {
        return chrome(new ChromeOptions());
    }

    /**
     * Creates a local ChromeDriver without a visible window.
     */
    public static WebDriver headlessChrome() {
        return chrome(new ChromeOptions().addArguments("--headless=new"));
    }

    /**
     * Creates a local ChromeDriver with provided options plus a device scale factor of 1,
     * so that screenshot pixels and viewport coordinates coincide.
     */
    public static WebDriver chrome(ChromeOptions options) {
        Objects.requireNonNull(options, "options must not be null");

        options.addArguments("--force-device-scale-factor=1", "--hide-scrollbars");
        WebDriver driver = new ChromeDriver(options);
        applyDefaults(driver);
        return driver;
    }

    /**
     * Creates a RemoteWebDriver with provided Selenium Grid (or Appium server) URL and capabilities.
     */
    public static WebDriver remote(URL remoteUrl, Capabilities capabilities) {
        Objects.requireNonNull(remoteUrl, "remoteUrl must not be null");
        Objects.requireNonNull(capabilities, "capabilities must not be null");

        return new RemoteWebDriver(remoteUrl, capabilities);
    }

    private static void applyDefaults(WebDriver driver) {
        driver.manage().window().setSize(DEFAULT_WINDOW_SIZE);
    }
}
