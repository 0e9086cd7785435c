package io.hearthwarrio.sightline.core;

import java.util.Objects;

/**
 * One occurrence of a template on the screen, in source-image pixels.
 * <p>
 * Plain value: it carries no reference to a driver. Use {@link MatchActions#activate(Match, TapDispatcher)}
 * to act on it.
 */
public final class Match {

    private final int centerX;
    private final int centerY;
    private final int width;
    private final int height;
    private final double similarity;
    private final String templatePath;

    public Match(int centerX, int centerY, int width, int height, double similarity) {
        this(centerX, centerY, width, height, similarity, "");
    }

    public Match(int centerX, int centerY, int width, int height, double similarity, String templatePath) {
        this.centerX = centerX;
        this.centerY = centerY;
        this.width = width;
        this.height = height;
        this.similarity = similarity;
        this.templatePath = templatePath == null ? "" : templatePath;
    }

    /**
     * Builds a match centered on the source-pixel box {@code [startX, endX) x [startY, endY)}.
     */
    static Match ofBounds(int startX, int startY, int endX, int endY, double similarity, String templatePath) {
        return new Match(
                (startX + endX) / 2,
                (startY + endY) / 2,
                endX - startX,
                endY - startY,
                similarity,
                templatePath
        );
    }

    public int getCenterX() {
        return centerX;
    }

    public int getCenterY() {
        return centerY;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double getSimilarity() {
        return similarity;
    }

    /**
     * @return template variant that produced this match, or an empty string if unknown
     */
    public String getTemplatePath() {
        return templatePath;
    }

    public int getLeft() {
        return centerX - width / 2;
    }

    public int getTop() {
        return centerY - height / 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Match)) {
            return false;
        }
        Match match = (Match) o;
        return centerX == match.centerX
                && centerY == match.centerY
                && width == match.width
                && height == match.height
                && Double.compare(similarity, match.similarity) == 0
                && templatePath.equals(match.templatePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(centerX, centerY, width, height, similarity, templatePath);
    }

    @Override
    public String toString() {
        return "Match{" +
                "center=(" + centerX + ", " + centerY + ")" +
                ", size=" + width + "x" + height +
                ", similarity=" + similarity +
                ", template=" + templatePath +
                '}';
    }
}
