package com.scout.core.stats;

/**
 * Score of one point of a series under a single outlier method: the z-score
 * for the z method, the IQR-normalised distance outside the fences for the
 * IQR method.
 *
 * @since 1.0.0
 */
public final class OutlierScore {

    private final int index;
    private final double score;
    private final boolean anomaly;

    OutlierScore(int index, double score, boolean anomaly) {
        this.index = index;
        this.score = score;
        this.anomaly = anomaly;
    }

    static OutlierScore normal(int index) {
        return new OutlierScore(index, 0.0, false);
    }

    public int getIndex() {
        return index;
    }

    public double getScore() {
        return score;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    @Override
    public String toString() {
        return "OutlierScore{index=" + index + ", score=" + score + ", anomaly=" + anomaly + '}';
    }
}
