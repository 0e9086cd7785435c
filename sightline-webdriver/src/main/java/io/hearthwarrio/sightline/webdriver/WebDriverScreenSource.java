package io.hearthwarrio.sightline.webdriver;

import io.hearthwarrio.sightline.core.GrayImage;
import io.hearthwarrio.sightline.core.ImageProcessor;
import io.hearthwarrio.sightline.core.ScreenSource;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.util.Objects;

/**
 * Captures the screen through {@link TakesScreenshot} and decodes it to grayscale.
 */
public class WebDriverScreenSource implements ScreenSource {

    private final WebDriver driver;
    private final ImageProcessor processor;

    public WebDriverScreenSource(WebDriver driver, ImageProcessor processor) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
    }

    /**
     * @throws ScreenCaptureException if the driver cannot take screenshots, the capture fails,
     *                                or the returned bytes are not an image
     */
    @Override
    public GrayImage capture() {
        if (!(driver instanceof TakesScreenshot ts)) {
            throw new ScreenCaptureException("Driver does not support screenshots: " + driver.getClass().getName());
        }

        byte[] png;
        try {
            png = ts.getScreenshotAs(OutputType.BYTES);
        } catch (WebDriverException e) {
            throw new ScreenCaptureException("Failed to take screenshot", e);
        }
        if (png == null || png.length == 0) {
            throw new ScreenCaptureException("Driver returned an empty screenshot");
        }

        try {
            return processor.decodeGray(png);
        } catch (IllegalArgumentException e) {
            throw new ScreenCaptureException("Screenshot is not a decodable image", e);
        }
    }
}
