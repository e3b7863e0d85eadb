package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Cross-property pattern derived from one run's anomaly set.
 *
 * <p>
 * Simultaneous patterns carry a single {@code date}; cascading patterns carry
 * {@code startDate}/{@code endDate}; metric correlations carry a
 * {@code correlatedMetric}, an {@code occurrenceCount} and a {@code strength}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Pattern {

    private final PatternType type;
    private final LocalDate date;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final Metric metric;
    private final Metric correlatedMetric;
    private final SortedSet<String> affectedEntities;
    private final int totalEntities;
    private final double confidence;
    private final ConfidenceLevel confidenceLevel;
    private final String likelyCause;
    private final Integer durationDays;
    private final Integer occurrenceCount;
    private final CorrelationStrength strength;

    private Pattern(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.metric = Objects.requireNonNull(builder.metric, "metric must not be null");
        this.date = builder.date;
        this.startDate = builder.startDate;
        this.endDate = builder.endDate;
        this.correlatedMetric = builder.correlatedMetric;
        this.affectedEntities = Collections.unmodifiableSortedSet(new TreeSet<>(builder.affectedEntities));
        this.totalEntities = builder.totalEntities;
        this.confidence = builder.confidence;
        this.confidenceLevel = builder.confidenceLevel;
        this.likelyCause = builder.likelyCause;
        this.durationDays = builder.durationDays;
        this.occurrenceCount = builder.occurrenceCount;
        this.strength = builder.strength;
        if (type == PatternType.SIMULTANEOUS && date == null) {
            throw new IllegalStateException("Simultaneous pattern requires a date");
        }
        if (type == PatternType.CASCADING && (startDate == null || endDate == null)) {
            throw new IllegalStateException("Cascading pattern requires a start and end date");
        }
        if (type == PatternType.METRIC_CORRELATION && correlatedMetric == null) {
            throw new IllegalStateException("Metric correlation requires a correlated metric");
        }
    }

    public static Builder builder(PatternType type) {
        return new Builder(type);
    }

    public static class Builder {
        private final PatternType type;
        private LocalDate date;
        private LocalDate startDate;
        private LocalDate endDate;
        private Metric metric;
        private Metric correlatedMetric;
        private final SortedSet<String> affectedEntities = new TreeSet<>();
        private int totalEntities;
        private double confidence;
        private ConfidenceLevel confidenceLevel;
        private String likelyCause;
        private Integer durationDays;
        private Integer occurrenceCount;
        private CorrelationStrength strength;

        private Builder(PatternType type) {
            this.type = type;
        }

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder range(LocalDate startDate, LocalDate endDate) {
            this.startDate = startDate;
            this.endDate = endDate;
            return this;
        }

        public Builder metric(Metric metric) {
            this.metric = metric;
            return this;
        }

        public Builder correlatedMetric(Metric correlatedMetric) {
            this.correlatedMetric = correlatedMetric;
            return this;
        }

        public Builder affectedEntities(Collection<String> propertyIds) {
            this.affectedEntities.addAll(propertyIds);
            return this;
        }

        public Builder totalEntities(int totalEntities) {
            this.totalEntities = totalEntities;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder confidenceLevel(ConfidenceLevel confidenceLevel) {
            this.confidenceLevel = confidenceLevel;
            return this;
        }

        public Builder likelyCause(String likelyCause) {
            this.likelyCause = likelyCause;
            return this;
        }

        public Builder durationDays(int durationDays) {
            this.durationDays = durationDays;
            return this;
        }

        public Builder occurrenceCount(int occurrenceCount) {
            this.occurrenceCount = occurrenceCount;
            return this;
        }

        public Builder strength(CorrelationStrength strength) {
            this.strength = strength;
            return this;
        }

        public Pattern build() {
            return new Pattern(this);
        }
    }

    // ---------------------------------------------------------------
    // Derived
    // ---------------------------------------------------------------

    public double getAffectedRatio() {
        return totalEntities == 0 ? 0.0 : (double) affectedEntities.size() / totalEntities;
    }

    public boolean involves(String propertyId) {
        return affectedEntities.contains(propertyId);
    }

    /**
     * @param day a date
     * @return whether the pattern's date (or date range) contains {@code day}
     */
    public boolean covers(LocalDate day) {
        if (date != null) {
            return date.equals(day);
        }
        return startDate != null && !day.isBefore(startDate) && !day.isAfter(endDate);
    }

    /**
     * Newly affected properties per calendar day of a cascading pattern.
     *
     * @return spread rate, or 0 for non-cascading patterns
     */
    @JsonIgnore
    public double getSpreadRate() {
        if (type != PatternType.CASCADING) {
            return 0.0;
        }
        long spanDays = ChronoUnit.DAYS.between(startDate, endDate) + 1;
        return (double) affectedEntities.size() / spanDays;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public PatternType getType() {
        return type;
    }

    public LocalDate getDate() {
        return date;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public Metric getMetric() {
        return metric;
    }

    public Metric getCorrelatedMetric() {
        return correlatedMetric;
    }

    public SortedSet<String> getAffectedEntities() {
        return affectedEntities;
    }

    public int getTotalEntities() {
        return totalEntities;
    }

    public double getConfidence() {
        return confidence;
    }

    public ConfidenceLevel getConfidenceLevel() {
        return confidenceLevel;
    }

    public String getLikelyCause() {
        return likelyCause;
    }

    public Integer getDurationDays() {
        return durationDays;
    }

    public Integer getOccurrenceCount() {
        return occurrenceCount;
    }

    public CorrelationStrength getStrength() {
        return strength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Pattern that))
            return false;
        return totalEntities == that.totalEntities
                && Double.compare(confidence, that.confidence) == 0
                && type == that.type
                && Objects.equals(date, that.date)
                && Objects.equals(startDate, that.startDate)
                && Objects.equals(endDate, that.endDate)
                && metric == that.metric
                && correlatedMetric == that.correlatedMetric
                && affectedEntities.equals(that.affectedEntities)
                && confidenceLevel == that.confidenceLevel
                && Objects.equals(likelyCause, that.likelyCause)
                && Objects.equals(durationDays, that.durationDays)
                && Objects.equals(occurrenceCount, that.occurrenceCount)
                && strength == that.strength;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, date, startDate, endDate, metric, correlatedMetric, affectedEntities);
    }

    @Override
    public String toString() {
        String when = date != null ? date.toString() : startDate + ".." + endDate;
        return "Pattern{" + type.getId() + ' ' + when + ' ' + metric.getId()
                + (correlatedMetric != null ? "+" + correlatedMetric.getId() : "")
                + ", affected=" + affectedEntities.size() + '/' + totalEntities
                + ", confidence=" + confidence + '}';
    }
}
