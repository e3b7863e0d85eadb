package com.scout.core.rootcause;

import com.scout.core.model.CandidateCause;
import com.scout.core.model.ConfidenceLevel;
import com.scout.core.model.RootCauseCorrelation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate view of a run's root-cause correlations.
 */
public final class RootCauseSummary {

    static final int TOP_CAUSES = 5;

    private final int totalCorrelations;
    private final int highConfidenceCount;
    private final Map<String, Integer> causeDistribution;
    private final List<CauseCount> topCauses;

    private RootCauseSummary(int totalCorrelations, int highConfidenceCount,
            Map<String, Integer> causeDistribution, List<CauseCount> topCauses) {
        this.totalCorrelations = totalCorrelations;
        this.highConfidenceCount = highConfidenceCount;
        this.causeDistribution = Collections.unmodifiableMap(causeDistribution);
        this.topCauses = List.copyOf(topCauses);
    }

    /**
     * @param correlations the run's correlations
     * @return summary with event-type distribution over all candidates and the
     *         five most frequent primary causes
     */
    public static RootCauseSummary of(List<RootCauseCorrelation> correlations) {
        Map<String, Integer> distribution = new TreeMap<>();
        Map<String, Integer> primaryCounts = new LinkedHashMap<>();
        int highConfidence = 0;
        for (RootCauseCorrelation c : correlations) {
            for (CandidateCause cause : c.getLikelyCauses()) {
                distribution.merge(cause.getEvent().getEventType().getId(), 1, Integer::sum);
            }
            primaryCounts.merge(c.getPrimaryCause(), 1, Integer::sum);
            if (c.getPrimaryConfidence().compareTo(ConfidenceLevel.HIGH) >= 0) {
                highConfidence++;
            }
        }

        List<CauseCount> top = new ArrayList<>();
        primaryCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_CAUSES)
                .forEach(e -> top.add(new CauseCount(e.getKey(), e.getValue(),
                        e.getValue() * 100.0 / correlations.size())));
        return new RootCauseSummary(correlations.size(), highConfidence, distribution, top);
    }

    public int getTotalCorrelations() {
        return totalCorrelations;
    }

    public int getHighConfidenceCount() {
        return highConfidenceCount;
    }

    public Map<String, Integer> getCauseDistribution() {
        return causeDistribution;
    }

    public List<CauseCount> getTopCauses() {
        return topCauses;
    }

    /** How many anomalies had a given primary cause. */
    public static final class CauseCount {
        private final String cause;
        private final int anomalyCount;
        private final double percentage;

        CauseCount(String cause, int anomalyCount, double percentage) {
            this.cause = cause;
            this.anomalyCount = anomalyCount;
            this.percentage = percentage;
        }

        public String getCause() {
            return cause;
        }

        public int getAnomalyCount() {
            return anomalyCount;
        }

        public double getPercentage() {
            return percentage;
        }
    }
}
