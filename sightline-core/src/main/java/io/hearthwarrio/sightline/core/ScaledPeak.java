package io.hearthwarrio.sightline.core;

import java.util.Objects;

/**
 * Best alignment found by {@link ScalePyramidSearcher}, together with the scale it was found at.
 * <p>
 * {@link #getRatio()} maps coordinates in {@link #getResized()} back to source-image pixels.
 */
public final class ScaledPeak {

    private final Peak peak;
    private final double ratio;
    private final GrayImage resized;

    public ScaledPeak(Peak peak, double ratio, GrayImage resized) {
        this.peak = Objects.requireNonNull(peak, "peak must not be null");
        this.ratio = ratio;
        this.resized = Objects.requireNonNull(resized, "resized must not be null");
    }

    public Peak getPeak() {
        return peak;
    }

    public double getScore() {
        return peak.getScore();
    }

    public double getRatio() {
        return ratio;
    }

    public GrayImage getResized() {
        return resized;
    }

    @Override
    public String toString() {
        return "ScaledPeak{" +
                "peak=" + peak +
                ", ratio=" + ratio +
                ", resized=" + resized +
                '}';
    }
}
