package io.hearthwarrio.sightline.webdriver;

import io.hearthwarrio.sightline.core.TapDispatcher;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.interactions.Interactive;
import org.openqa.selenium.interactions.PointerInput;
import org.openqa.selenium.interactions.Sequence;

import java.time.Duration;
import java.util.Collections;
import java.util.Objects;

/**
 * Taps through W3C actions: pointer move to the viewport point, press, release.
 * <p>
 * Screenshot pixels are divided by {@code pixelRatio} to get viewport coordinates
 * (e.g. 2.0 on a HiDPI desktop browser, 1.0 on Appium where screenshots are in device pixels).
 */
public class WebDriverTapDispatcher implements TapDispatcher {

    private final WebDriver driver;
    private final PointerInput.Kind kind;
    private final double pixelRatio;

    public WebDriverTapDispatcher(WebDriver driver) {
        this(driver, PointerInput.Kind.TOUCH, 1.0);
    }

    public WebDriverTapDispatcher(WebDriver driver, PointerInput.Kind kind, double pixelRatio) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (!(pixelRatio > 0)) {
            throw new IllegalArgumentException("pixelRatio must be positive: " + pixelRatio);
        }
        this.pixelRatio = pixelRatio;
    }

    @Override
    public void tap(int x, int y) {
        if (!(driver instanceof Interactive interactive)) {
            throw new UnsupportedOperationException(
                    "Driver does not support W3C actions: " + driver.getClass().getName());
        }
        interactive.perform(Collections.singletonList(tapSequence(x, y)));
    }

    Sequence tapSequence(int x, int y) {
        PointerInput pointer = new PointerInput(kind, kind == PointerInput.Kind.TOUCH ? "finger" : "mouse");
        Sequence tap = new Sequence(pointer, 1);
        tap.addAction(pointer.createPointerMove(
                Duration.ZERO,
                PointerInput.Origin.viewport(),
                (int) Math.round(x / pixelRatio),
                (int) Math.round(y / pixelRatio)
        ));
        tap.addAction(pointer.createPointerDown(PointerInput.MouseButton.LEFT.asArg()));
        tap.addAction(pointer.createPointerUp(PointerInput.MouseButton.LEFT.asArg()));
        return tap;
    }
}
