package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One day of metrics for one dimension value, as delivered by the data
 * extraction collaborator.
 *
 * <p>
 * The same shape is used for the site-wide {@code clean_dataset} rows and for
 * every segment array; segment rows additionally carry the field that names
 * their dimension value ({@code country}, {@code device_category},
 * {@code source}/{@code medium} or {@code landing_page}).
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DailyMetrics {

    private LocalDate date;
    private double sessions;
    private double users;

    @JsonProperty("page_views")
    private double pageViews;

    private double conversions;

    /** Bounce rate percentage (0-100); {@code null} when not extracted. */
    @JsonProperty("bounce_rate")
    private Double bounceRate;

    /** Average session duration in seconds; {@code null} when not extracted. */
    @JsonProperty("avg_session_duration")
    private Double avgSessionDuration;

    // --- Segment keys ---
    private String country;

    @JsonProperty("device_category")
    private String deviceCategory;

    private String source;
    private String medium;

    @JsonProperty("landing_page")
    private String landingPage;

    /** No-arg constructor required by Jackson. */
    public DailyMetrics() {
    }

    /**
     * Value of the given metric for this day.
     *
     * @param metric the metric; must not be {@code null}
     * @return metric value
     */
    public double valueOf(Metric metric) {
        Objects.requireNonNull(metric, "metric must not be null");
        return switch (metric) {
            case SESSIONS -> sessions;
            case USERS -> users;
            case PAGE_VIEWS -> pageViews;
            case CONVERSIONS -> conversions;
        };
    }

    /**
     * Dimension value this row belongs to.
     *
     * @param dimension the dimension the row was delivered under
     * @return dimension value, or {@code null} if the row lacks its key
     */
    public String dimensionValue(Dimension dimension) {
        return switch (dimension) {
            case OVERALL -> Dimension.SITE_WIDE;
            case GEOGRAPHY -> country;
            case DEVICE -> deviceCategory;
            case TRAFFIC_SOURCE -> (source == null ? "" : source) + "/" + (medium == null ? "" : medium);
            case LANDING_PAGE -> landingPage;
        };
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

    public double getSessions() {
        return sessions;
    }

    public void setSessions(double sessions) {
        this.sessions = sessions;
    }

    public double getUsers() {
        return users;
    }

    public void setUsers(double users) {
        this.users = users;
    }

    public double getPageViews() {
        return pageViews;
    }

    public void setPageViews(double pageViews) {
        this.pageViews = pageViews;
    }

    public double getConversions() {
        return conversions;
    }

    public void setConversions(double conversions) {
        this.conversions = conversions;
    }

    public Double getBounceRate() {
        return bounceRate;
    }

    public void setBounceRate(Double bounceRate) {
        this.bounceRate = bounceRate;
    }

    public Double getAvgSessionDuration() {
        return avgSessionDuration;
    }

    public void setAvgSessionDuration(Double avgSessionDuration) {
        this.avgSessionDuration = avgSessionDuration;
    }

    public String getCountry() {
        return country;
    }

    public void setCountry(String country) {
        this.country = country;
    }

    public String getDeviceCategory() {
        return deviceCategory;
    }

    public void setDeviceCategory(String deviceCategory) {
        this.deviceCategory = deviceCategory;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getMedium() {
        return medium;
    }

    public void setMedium(String medium) {
        this.medium = medium;
    }

    public String getLandingPage() {
        return landingPage;
    }

    public void setLandingPage(String landingPage) {
        this.landingPage = landingPage;
    }

    @Override
    public String toString() {
        return "DailyMetrics{" +
                "date=" + date +
                ", sessions=" + sessions +
                ", users=" + users +
                ", pageViews=" + pageViews +
                ", conversions=" + conversions +
                '}';
    }
}
