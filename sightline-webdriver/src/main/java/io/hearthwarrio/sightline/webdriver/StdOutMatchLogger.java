package io.hearthwarrio.sightline.webdriver;

import io.hearthwarrio.sightline.core.ElementQuery;
import io.hearthwarrio.sightline.core.Match;
import io.hearthwarrio.sightline.core.SearchResult;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Default stdout logger for searches and taps.
 * <p>
 * One {@code [Sightline]} line per search, followed by indented match lines as {@link #detail()} asks.
 */
public final class StdOutMatchLogger implements MatchLogger {

    private final MatchLogDetail detail;
    private final PrintStream out;

    public StdOutMatchLogger(MatchLogDetail detail) {
        this(detail, System.out);
    }

    StdOutMatchLogger(MatchLogDetail detail, PrintStream out) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public MatchLogDetail detail() {
        return detail;
    }

    @Override
    public void logSearch(String elementName, ElementQuery query, SearchResult result) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("[Sightline] element='").append(safe(elementName)).append('\'')
                .append(", template='").append(query.getTemplateSource()).append('\'')
                .append(", found=").append(result.size());

        String matches = MatchLogFormat.describe(result, detail, "  ");
        if (!matches.isEmpty()) {
            sb.append('\n').append(matches);
        }
        out.println(sb);
    }

    @Override
    public void logTap(String elementName, Match match) {
        out.println("[Sightline] tap element='" + safe(elementName) + "' at ("
                + match.getCenterX() + "," + match.getCenterY() + ")");
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
