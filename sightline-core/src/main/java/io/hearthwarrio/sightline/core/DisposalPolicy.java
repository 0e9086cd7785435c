package io.hearthwarrio.sightline.core;

import java.util.Comparator;

/**
 * Ranking rule applied to the occurrences of one element.
 */
public enum DisposalPolicy {

    /**
     * Most similar first.
     */
    BY_CONFIDENCE_DESC(0, Comparator.<Match>comparingDouble(Match::getSimilarity).reversed()),

    /**
     * Top of the screen first.
     */
    BY_VERTICAL_ASC(1, Comparator.comparingInt(Match::getCenterY)),

    /**
     * Left of the screen first.
     */
    BY_HORIZONTAL_ASC(2, Comparator.comparingInt(Match::getCenterX));

    private final int code;
    private final Comparator<Match> comparator;

    DisposalPolicy(int code, Comparator<Match> comparator) {
        this.code = code;
        this.comparator = comparator;
    }

    /**
     * Integer code used by configuration files and older callers (0, 1, 2).
     */
    public int getCode() {
        return code;
    }

    public Comparator<Match> comparator() {
        return comparator;
    }

    /**
     * @throws ConfigurationException if {@code code} is not one of the known policies
     */
    public static DisposalPolicy fromCode(int code) {
        for (DisposalPolicy p : values()) {
            if (p.code == code) {
                return p;
            }
        }
        throw new ConfigurationException("Disposal policy not valid: " + code);
    }
}
