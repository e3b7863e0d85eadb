package com.scout.core;

import com.scout.core.model.Anomaly;
import com.scout.core.model.ClientMetadata;
import com.scout.core.model.DailyMetrics;
import com.scout.core.model.DetectorType;
import com.scout.core.model.Metric;
import com.scout.core.model.Priority;
import com.scout.core.model.PropertyDataset;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for small in-memory property datasets.
 */
public final class TestDatasets {

    /** Latest day of every generated series (a Wednesday). */
    public static final LocalDate END = LocalDate.of(2024, 6, 12);

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-13T06:00:00Z"), ZoneOffset.UTC);

    private TestDatasets() {
        // utility class
    }

    /**
     * Daily site-wide rows ending on {@link #END}: users equal sessions, page
     * views are twice the sessions, conversions are 10, bounce rate 40% and
     * average session duration 120 s.
     */
    public static List<DailyMetrics> rows(double... sessions) {
        List<DailyMetrics> rows = new ArrayList<>(sessions.length);
        for (int i = 0; i < sessions.length; i++) {
            rows.add(row(END.minusDays(sessions.length - 1L - i), sessions[i]));
        }
        return rows;
    }

    public static DailyMetrics row(LocalDate date, double sessions) {
        DailyMetrics row = new DailyMetrics();
        row.setDate(date);
        row.setSessions(sessions);
        row.setUsers(sessions);
        row.setPageViews(sessions * 2);
        row.setConversions(10);
        row.setBounceRate(40.0);
        row.setAvgSessionDuration(120.0);
        return row;
    }

    public static PropertyDataset dataset(String propertyId, double... sessions) {
        return dataset(propertyId, rows(sessions));
    }

    public static PropertyDataset dataset(String propertyId, List<DailyMetrics> rows) {
        PropertyDataset dataset = new PropertyDataset();
        dataset.setClientMetadata(new ClientMetadata(propertyId, "https://www." + propertyId + ".example/",
                "Client " + propertyId));
        dataset.setCleanDataset(rows);
        return dataset;
    }

    /**
     * A P2 segment drop with the given business impact.
     */
    public static Anomaly anomaly(String propertyId, LocalDate date, Metric metric, int businessImpact) {
        return anomaly(propertyId, date, metric, Priority.P2, businessImpact);
    }

    public static Anomaly anomaly(String propertyId, LocalDate date, Metric metric, Priority priority,
            int businessImpact) {
        return Anomaly.builder()
                .propertyId(propertyId)
                .date(date)
                .detectorType(DetectorType.SEGMENT)
                .priority(priority)
                .metric(metric)
                .value(50)
                .baseline(100.0)
                .classification("drop")
                .businessImpact(businessImpact)
                .message(metric.getId() + " dropped")
                .detectedAt(CLOCK.instant())
                .build();
    }

    /** {@code count} copies of {@code value}. */
    public static double[] repeat(double value, int count) {
        double[] values = new double[count];
        Arrays.fill(values, value);
        return values;
    }

    public static double[] concat(double[]... parts) {
        int length = 0;
        for (double[] part : parts) {
            length += part.length;
        }
        double[] all = new double[length];
        int offset = 0;
        for (double[] part : parts) {
            System.arraycopy(part, 0, all, offset, part.length);
            offset += part.length;
        }
        return all;
    }
}
