package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Known external event (algorithm update, holiday, platform change) that
 * anomalies can be correlated with.
 *
 * <p>
 * Events are reference data read from the versioned event calendar. Call
 * {@link #validate()} after deserialization; the calendar loader does this
 * for every entry.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExternalEvent {

    private LocalDate date;

    @JsonProperty("event_type")
    private EventType eventType;

    private String name;
    private String description;

    @JsonProperty("impact_level")
    private ImpactLevel impactLevel;

    @JsonProperty("affected_metrics")
    private List<Metric> affectedMetrics = new ArrayList<>();

    @JsonProperty("typical_duration_days")
    private int typicalDurationDays = 1;

    /** Base correlation score in [0, 1]. */
    @JsonProperty("confidence_boost")
    private double confidenceBoost;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public ExternalEvent() {
    }

    private ExternalEvent(Builder builder) {
        this.date = Objects.requireNonNull(builder.date, "date must not be null");
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType must not be null");
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.description = builder.description;
        this.impactLevel = Objects.requireNonNull(builder.impactLevel, "impactLevel must not be null");
        this.affectedMetrics = new ArrayList<>(builder.affectedMetrics);
        this.typicalDurationDays = builder.typicalDurationDays;
        this.confidenceBoost = builder.confidenceBoost;
    }

    /**
     * Synthetic candidate for anomalies falling on a Monday.
     *
     * @param date the Monday
     * @return weekend recovery event
     */
    public static ExternalEvent weekendRecovery(LocalDate date) {
        return builder()
                .date(date)
                .eventType(EventType.WEEKEND_EFFECT)
                .name("Monday (Weekend Recovery)")
                .description("Traffic recovery after weekend")
                .impactLevel(ImpactLevel.LOW)
                .affectedMetrics(Metric.SESSIONS, Metric.USERS)
                .typicalDurationDays(1)
                .confidenceBoost(0.40)
                .build();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ExternalEvent}; {@code date}, {@code eventType},
     * {@code name} and {@code impactLevel} are required.
     */
    public static class Builder {
        private LocalDate date;
        private EventType eventType;
        private String name;
        private String description;
        private ImpactLevel impactLevel;
        private final List<Metric> affectedMetrics = new ArrayList<>();
        private int typicalDurationDays = 1;
        private double confidenceBoost;

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder eventType(EventType eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder impactLevel(ImpactLevel impactLevel) {
            this.impactLevel = impactLevel;
            return this;
        }

        public Builder affectedMetrics(Metric... metrics) {
            this.affectedMetrics.clear();
            Collections.addAll(this.affectedMetrics, metrics);
            return this;
        }

        public Builder typicalDurationDays(int typicalDurationDays) {
            this.typicalDurationDays = typicalDurationDays;
            return this;
        }

        public Builder confidenceBoost(double confidenceBoost) {
            this.confidenceBoost = confidenceBoost;
            return this;
        }

        public ExternalEvent build() {
            return new ExternalEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that every required field is present and within range.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        String label = name != null ? name : "<unnamed>";

        if (date == null) {
            errors.add("Event '" + label + "' requires 'date'");
        }
        if (eventType == null) {
            errors.add("Event '" + label + "' requires 'event_type'");
        }
        if (name == null || name.isBlank()) {
            errors.add("Event 'name' is required");
        }
        if (impactLevel == null) {
            errors.add("Event '" + label + "' requires 'impact_level'");
        }
        if (confidenceBoost < 0.0 || confidenceBoost > 1.0) {
            errors.add("Event '" + label + "' requires 'confidence_boost' in [0, 1], got " + confidenceBoost);
        }
        if (typicalDurationDays < 0) {
            errors.add("Event '" + label + "' requires 'typical_duration_days' >= 0");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    public boolean affects(Metric metric) {
        return affectedMetrics.contains(metric);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public ImpactLevel getImpactLevel() {
        return impactLevel;
    }

    public void setImpactLevel(ImpactLevel impactLevel) {
        this.impactLevel = impactLevel;
    }

    public Set<Metric> getAffectedMetrics() {
        return affectedMetrics.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(affectedMetrics));
    }

    public void setAffectedMetrics(List<Metric> affectedMetrics) {
        this.affectedMetrics = affectedMetrics != null ? new ArrayList<>(affectedMetrics) : new ArrayList<>();
    }

    public int getTypicalDurationDays() {
        return typicalDurationDays;
    }

    public void setTypicalDurationDays(int typicalDurationDays) {
        this.typicalDurationDays = typicalDurationDays;
    }

    public double getConfidenceBoost() {
        return confidenceBoost;
    }

    public void setConfidenceBoost(double confidenceBoost) {
        this.confidenceBoost = confidenceBoost;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ExternalEvent that))
            return false;
        return Objects.equals(date, that.date)
                && eventType == that.eventType
                && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, eventType, name);
    }

    @Override
    public String toString() {
        return "ExternalEvent{" + date + ' ' + name + " (" + eventType + ", " + impactLevel + ")}";
    }
}
