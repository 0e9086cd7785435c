package io.hearthwarrio.sightline.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Descending sequence of scale factors applied to the source image.
 */
public final class ScalePyramid {

    public static final double DEFAULT_MIN_SCALE = 0.2;
    public static final double DEFAULT_MAX_SCALE = 1.0;
    public static final int DEFAULT_STEPS = 20;

    private static final ScalePyramid DEFAULT = linear(DEFAULT_MIN_SCALE, DEFAULT_MAX_SCALE, DEFAULT_STEPS);

    private final List<Double> scales;

    private ScalePyramid(List<Double> scales) {
        this.scales = Collections.unmodifiableList(scales);
    }

    /**
     * 20 linearly spaced factors in {@code [0.2, 1.0]}, largest first.
     */
    public static ScalePyramid defaultPyramid() {
        return DEFAULT;
    }

    /**
     * Only the native scale. Useful when the capture resolution matches the template source.
     */
    public static ScalePyramid nativeOnly() {
        return linear(1.0, 1.0, 1);
    }

    /**
     * {@code steps} linearly spaced factors in {@code [minScale, maxScale]} (both ends included), largest first.
     */
    public static ScalePyramid linear(double minScale, double maxScale, int steps) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be >= 1, got " + steps);
        }
        if (minScale <= 0.0 || maxScale > 1.0 || minScale > maxScale) {
            throw new IllegalArgumentException(
                    "scale range must satisfy 0 < min <= max <= 1, got [" + minScale + ", " + maxScale + "]"
            );
        }
        List<Double> out = new ArrayList<>(steps);
        if (steps == 1) {
            out.add(maxScale);
            return new ScalePyramid(out);
        }
        double step = (maxScale - minScale) / (steps - 1);
        out.add(maxScale);
        for (int i = steps - 2; i >= 0; i--) {
            out.add(minScale + i * step);
        }
        return new ScalePyramid(out);
    }

    /**
     * @return scale factors, largest first (read-only)
     */
    public List<Double> getScales() {
        return scales;
    }

    @Override
    public String toString() {
        return "ScalePyramid" + scales;
    }
}
