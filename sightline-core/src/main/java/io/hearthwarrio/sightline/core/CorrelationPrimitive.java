package io.hearthwarrio.sightline.core;

/**
 * 2D template correlation over grayscale images.
 * <p>
 * Implementations must not modify their inputs.
 */
public interface CorrelationPrimitive {

    /**
     * Scores every placement of {@code template} fully inside {@code image}.
     *
     * @param image    image to search in, at least as large as the template in both axes
     * @param template template to place
     * @param method   similarity metric
     * @return score map of size {@code (W - w + 1) x (H - h + 1)}
     */
    ScoreMap correlate(GrayImage image, GrayImage template, MatchMethod method);

    /**
     * Global maximum of a score map. On ties the first position in row-major order wins.
     */
    default Peak argmax(ScoreMap map) {
        return map.max();
    }

    /**
     * Shortcut for {@code argmax(correlate(image, template, method))}.
     * Implementations may override it to skip materializing the score map.
     */
    default Peak bestPeak(GrayImage image, GrayImage template, MatchMethod method) {
        return argmax(correlate(image, template, method));
    }
}
