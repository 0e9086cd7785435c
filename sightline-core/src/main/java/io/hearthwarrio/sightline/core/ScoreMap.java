package io.hearthwarrio.sightline.core;

import java.util.Objects;

/**
 * Per-alignment similarity scores produced by a {@link CorrelationPrimitive}.
 * <p>
 * For an image of size {@code W x H} and a template of size {@code w x h} the map is
 * {@code (W - w + 1) x (H - h + 1)}; the value at {@code (x, y)} scores the template placed with its
 * top-left corner at {@code (x, y)}.
 */
public final class ScoreMap {

    private final int width;
    private final int height;
    private final float[] scores;

    public ScoreMap(int width, int height, float[] scores) {
        Objects.requireNonNull(scores, "scores must not be null");
        if (width <= 0 || height <= 0 || scores.length != width * height) {
            throw new IllegalArgumentException(
                    "Score buffer length " + scores.length + " does not match " + width + "x" + height
            );
        }
        this.width = width;
        this.height = height;
        this.scores = scores.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double get(int x, int y) {
        return scores[y * width + x];
    }

    /**
     * Returns the first (row-major) position holding the highest score.
     */
    public Peak max() {
        int best = 0;
        for (int i = 1; i < scores.length; i++) {
            if (scores[i] > scores[best]) {
                best = i;
            }
        }
        return new Peak(scores[best], best % width, best / width);
    }
}
