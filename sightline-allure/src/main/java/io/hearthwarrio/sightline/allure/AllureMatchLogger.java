package io.hearthwarrio.sightline.allure;

import io.hearthwarrio.sightline.core.ElementQuery;
import io.hearthwarrio.sightline.core.Match;
import io.hearthwarrio.sightline.core.SearchResult;
import io.hearthwarrio.sightline.webdriver.MatchLogDetail;
import io.hearthwarrio.sightline.webdriver.MatchLogFormat;
import io.hearthwarrio.sightline.webdriver.MatchLogger;
import io.qameta.allure.Allure;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Allure logger for searches and taps.
 * <p>
 * Lives in sightline-allure to avoid leaking Allure dependency into core/webdriver.
 */
public final class AllureMatchLogger implements MatchLogger {

    private final WebDriver driver;
    private final MatchLogDetail detail;
    private final boolean attachScreenshot;

    public AllureMatchLogger(WebDriver driver, MatchLogDetail detail, boolean attachScreenshot) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.detail = detail == null ? MatchLogDetail.NONE : detail;
        this.attachScreenshot = attachScreenshot;
    }

    @Override
    public MatchLogDetail detail() {
        return detail;
    }

    @Override
    public void logSearch(String elementName, ElementQuery query, SearchResult result) {
        String title = "Sightline: " + safe(elementName) + " - found " + result.size();

        Allure.step(title, () -> {
            String text = describe(elementName, query, result);
            Allure.addAttachment(
                    "Search result",
                    "text/plain",
                    new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)),
                    ".txt"
            );
            attachScreenshotIfEnabled();
        });
    }

    @Override
    public void logTap(String elementName, Match match) {
        Allure.step("Sightline: tap " + safe(elementName) + " at (" + match.getCenterX() + "," + match.getCenterY() + ")");
    }

    String describe(String elementName, ElementQuery query, SearchResult result) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("element: ").append(safe(elementName)).append('\n')
                .append("template: ").append(query.getTemplateSource()).append('\n')
                .append("similarity: ").append(query.getSimilarityThreshold()).append('\n')
                .append("method: ").append(query.getMethod()).append('\n')
                .append("disposal: ").append(query.getDisposalPolicy()).append('\n')
                .append("found: ").append(result.size()).append('\n');

        String matches = MatchLogFormat.describe(result, detail, "");
        if (!matches.isEmpty()) {
            sb.append(matches).append('\n');
        }
        return sb.toString();
    }

    private void attachScreenshotIfEnabled() {
        if (attachScreenshot && driver instanceof TakesScreenshot ts) {
            byte[] png = ts.getScreenshotAs(OutputType.BYTES);
            Allure.addAttachment(
                    "Screenshot",
                    "image/png",
                    new ByteArrayInputStream(png),
                    ".png"
            );
        }
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
