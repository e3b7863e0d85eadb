package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Clean per-property extract: the site-wide daily series plus the optional
 * segment arrays, as produced by the data extraction collaborator.
 *
 * <p>
 * A missing segment array means the dimension is skipped by every detector;
 * it is not an error.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PropertyDataset {

    @JsonProperty("client_metadata")
    private ClientMetadata clientMetadata = new ClientMetadata();

    @JsonProperty("clean_dataset")
    private List<DailyMetrics> cleanDataset = new ArrayList<>();

    @JsonProperty("geo_segments")
    private List<DailyMetrics> geoSegments;

    @JsonProperty("device_segments")
    private List<DailyMetrics> deviceSegments;

    @JsonProperty("traffic_segments")
    private List<DailyMetrics> trafficSegments;

    @JsonProperty("page_segments")
    private List<DailyMetrics> pageSegments;

    public PropertyDataset() {
    }

    // ---------------------------------------------------------------
    // Series extraction
    // ---------------------------------------------------------------

    /**
     * Rows delivered for a dimension.
     *
     * @param dimension the dimension
     * @return rows, or an empty list when the segment array is absent
     */
    public List<DailyMetrics> rows(Dimension dimension) {
        List<DailyMetrics> rows = switch (dimension) {
            case OVERALL -> cleanDataset;
            case GEOGRAPHY -> geoSegments;
            case DEVICE -> deviceSegments;
            case TRAFFIC_SOURCE -> trafficSegments;
            case LANDING_PAGE -> pageSegments;
        };
        return rows == null ? List.of() : Collections.unmodifiableList(rows);
    }

    public boolean hasDimension(Dimension dimension) {
        return !rows(dimension).isEmpty();
    }

    /**
     * Split a dimension's rows into one series per dimension value.
     *
     * <p>
     * Series are returned in order of first appearance of their value. Rows
     * without a date or without a dimension value are ignored.
     * </p>
     *
     * @param dimension dimension to split
     * @param metric    metric to project
     * @return date-ordered series, one per dimension value
     * @throws IllegalArgumentException if a row carries a negative value
     */
    public List<MetricSeries> series(Dimension dimension, Metric metric) {
        Map<String, List<MetricObservation>> byValue = new LinkedHashMap<>();
        for (DailyMetrics row : rows(dimension)) {
            if (row == null || row.getDate() == null) {
                continue;
            }
            String value = row.dimensionValue(dimension);
            if (value == null || value.isBlank()) {
                continue;
            }
            byValue.computeIfAbsent(value, k -> new ArrayList<>())
                    .add(MetricObservation.from(getPropertyId(), dimension, row, metric));
        }
        List<MetricSeries> result = new ArrayList<>(byValue.size());
        byValue.forEach((value, observations) -> result.add(
                new MetricSeries(getPropertyId(), dimension, value, metric, observations)));
        return result;
    }

    /**
     * @param metric metric to project
     * @return the site-wide series (possibly empty)
     */
    public MetricSeries overall(Metric metric) {
        List<MetricSeries> series = series(Dimension.OVERALL, metric);
        return series.isEmpty()
                ? new MetricSeries(getPropertyId(), Dimension.OVERALL, Dimension.SITE_WIDE, metric, List.of())
                : series.get(0);
    }

    /**
     * @return the most recent date of the site-wide series, if any
     */
    public Optional<LocalDate> latestDate() {
        return cleanDataset == null
                ? Optional.empty()
                : cleanDataset.stream()
                        .filter(row -> row != null && row.getDate() != null)
                        .map(DailyMetrics::getDate)
                        .max(LocalDate::compareTo);
    }

    public String getPropertyId() {
        return clientMetadata == null ? null : clientMetadata.getPropertyId();
    }

    public String domain() {
        return clientMetadata == null ? "" : clientMetadata.domain();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public ClientMetadata getClientMetadata() {
        return clientMetadata;
    }

    public void setClientMetadata(ClientMetadata clientMetadata) {
        this.clientMetadata = clientMetadata;
    }

    public List<DailyMetrics> getCleanDataset() {
        return cleanDataset;
    }

    public void setCleanDataset(List<DailyMetrics> cleanDataset) {
        this.cleanDataset = cleanDataset != null ? new ArrayList<>(cleanDataset) : new ArrayList<>();
    }

    public List<DailyMetrics> getGeoSegments() {
        return geoSegments;
    }

    public void setGeoSegments(List<DailyMetrics> geoSegments) {
        this.geoSegments = geoSegments;
    }

    public List<DailyMetrics> getDeviceSegments() {
        return deviceSegments;
    }

    public void setDeviceSegments(List<DailyMetrics> deviceSegments) {
        this.deviceSegments = deviceSegments;
    }

    public List<DailyMetrics> getTrafficSegments() {
        return trafficSegments;
    }

    public void setTrafficSegments(List<DailyMetrics> trafficSegments) {
        this.trafficSegments = trafficSegments;
    }

    public List<DailyMetrics> getPageSegments() {
        return pageSegments;
    }

    public void setPageSegments(List<DailyMetrics> pageSegments) {
        this.pageSegments = pageSegments;
    }

    @Override
    public String toString() {
        return "PropertyDataset{propertyId='" + getPropertyId() + "', days="
                + (cleanDataset == null ? 0 : cleanDataset.size()) + '}';
    }
}
