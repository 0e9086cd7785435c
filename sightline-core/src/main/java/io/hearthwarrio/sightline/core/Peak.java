package io.hearthwarrio.sightline.core;

/**
 * Global maximum of a {@link ScoreMap}: the score and the top-left corner of the alignment that produced it.
 */
public final class Peak {

    private final double score;
    private final int x;
    private final int y;

    public Peak(double score, int x, int y) {
        this.score = score;
        this.x = x;
        this.y = y;
    }

    public double getScore() {
        return score;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    @Override
    public String toString() {
        return "Peak{" +
                "score=" + score +
                ", x=" + x +
                ", y=" + y +
                '}';
    }
}
