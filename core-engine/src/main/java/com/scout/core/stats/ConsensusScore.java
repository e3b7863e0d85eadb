package com.scout.core.stats;

/**
 * Combined verdict of the z-score and IQR methods for one point. The point is
 * anomalous when either method flags it.
 */
public final class ConsensusScore {

    private final int index;
    private final double value;
    private final OutlierScore zScore;
    private final OutlierScore iqr;

    ConsensusScore(int index, double value, OutlierScore zScore, OutlierScore iqr) {
        this.index = index;
        this.value = value;
        this.zScore = zScore;
        this.iqr = iqr;
    }

    public boolean isAnomaly() {
        return zScore.isAnomaly() || iqr.isAnomaly();
    }

    /** {@code max(|z|, iqr distance)}. */
    public double getSeverity() {
        return Math.max(Math.abs(zScore.getScore()), iqr.getScore());
    }

    public int getIndex() {
        return index;
    }

    public double getValue() {
        return value;
    }

    public double getZScore() {
        return zScore.getScore();
    }

    public double getIqrDistance() {
        return iqr.getScore();
    }

    public boolean isZScoreAnomaly() {
        return zScore.isAnomaly();
    }

    public boolean isIqrAnomaly() {
        return iqr.isAnomaly();
    }

    @Override
    public String toString() {
        return "ConsensusScore{index=" + index + ", value=" + value + ", severity=" + getSeverity()
                + ", anomaly=" + isAnomaly() + '}';
    }
}
