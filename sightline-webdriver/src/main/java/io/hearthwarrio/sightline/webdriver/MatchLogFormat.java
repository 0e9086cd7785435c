package io.hearthwarrio.sightline.webdriver;

import io.hearthwarrio.sightline.core.Match;
import io.hearthwarrio.sightline.core.SearchResult;

import java.util.Locale;

/**
 * Text rendering of search results shared by the bundled loggers.
 */
public final class MatchLogFormat {

    private MatchLogFormat() {
        // utility class
    }

    /**
     * {@code (cx,cy) wxh similarity=0.97 template=path}
     */
    public static String describe(Match match) {
        StringBuilder sb = new StringBuilder(96);
        sb.append('(').append(match.getCenterX()).append(',').append(match.getCenterY()).append(") ")
                .append(match.getWidth()).append('x').append(match.getHeight())
                .append(" similarity=").append(String.format(Locale.ROOT, "%.3f", match.getSimilarity()));
        if (!match.getTemplatePath().isEmpty()) {
            sb.append(" template=").append(match.getTemplatePath());
        }
        return sb.toString();
    }

    /**
     * Lists the matches {@code detail} asks for, one per line, each prefixed with {@code indent}.
     */
    public static String describe(SearchResult result, MatchLogDetail detail, String indent) {
        if (detail == MatchLogDetail.NONE || result.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (detail == MatchLogDetail.BEST) {
            return sb.append(indent).append("best: ").append(describe(result.first())).toString();
        }
        for (int i = 0; i < result.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(indent).append('#').append(i).append(": ").append(describe(result.get(i)));
        }
        return sb.toString();
    }
}
