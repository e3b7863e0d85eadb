package com.scout.core.io;

import com.scout.core.model.Dimension;
import com.scout.core.model.Metric;
import com.scout.core.model.MetricSeries;
import com.scout.core.model.PropertyDataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PropertyDatasetReader}.
 */
class PropertyDatasetReaderTest {

    private final PropertyDatasetReader reader = new PropertyDatasetReader();

    @Test
    @DisplayName("Should read metadata, site-wide rows and segments while ignoring unknown fields")
    void shouldReadValidDocument() throws Exception {
        PropertyDataset dataset = readFixture("property-valid.json");

        assertThat(dataset.getPropertyId()).isEqualTo("123456789");
        assertThat(dataset.domain()).isEqualTo("acme-outdoors.com");
        assertThat(dataset.latestDate()).contains(LocalDate.of(2024, 6, 12));
        assertThat(dataset.overall(Metric.SESSIONS).latest().getValue()).isEqualTo(1150.0);
        assertThat(dataset.getCleanDataset().get(0).getBounceRate()).isEqualTo(41.5);
        assertThat(dataset.series(Dimension.GEOGRAPHY, Metric.SESSIONS))
                .extracting(MetricSeries::getDimensionValue)
                .containsExactly("United States", "Canada");
        assertThat(dataset.hasDimension(Dimension.DEVICE)).isTrue();
        assertThat(dataset.hasDimension(Dimension.TRAFFIC_SOURCE)).isFalse();
    }

    @Test
    @DisplayName("Should reject a document without a property id")
    void shouldRejectMissingPropertyId() {
        assertThatThrownBy(() -> readFixture("property-missing-id.json"))
                .isInstanceOf(PropertyLoadException.class)
                .hasMessage("property-missing-id.json: client_metadata.property_id is missing");
    }

    @Test
    @DisplayName("Should reject malformed JSON with the source in the message")
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> readFixture("property-malformed.json"))
                .isInstanceOf(PropertyLoadException.class)
                .hasMessageStartingWith("property-malformed.json: malformed property JSON")
                .satisfies(e -> assertThat(((PropertyLoadException) e).getSource())
                        .isEqualTo("property-malformed.json"));
    }

    @Test
    @DisplayName("Should reject a document without clean_dataset")
    void shouldRejectMissingDataset() {
        InputStream in = new ByteArrayInputStream(
                "{\"client_metadata\": {\"property_id\": \"42\"}}".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> reader.read("inline", in))
                .isInstanceOf(PropertyLoadException.class)
                .hasMessage("inline: clean_dataset is missing");
    }

    @Test
    @DisplayName("Should reject an empty document")
    void shouldRejectEmptyDocument() {
        InputStream in = new ByteArrayInputStream("null".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> reader.read("inline", in))
                .isInstanceOf(PropertyLoadException.class)
                .hasMessage("inline: empty document");
    }

    @Test
    @DisplayName("Should wrap an unreadable file in PropertyLoadException")
    void shouldRejectMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> reader.read(dir.resolve("absent.json")))
                .isInstanceOf(PropertyLoadException.class)
                .hasMessage("absent.json: unable to read file")
                .hasCauseInstanceOf(IOException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private PropertyDataset readFixture(String name) throws Exception {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("fixtures/" + name)) {
            return reader.read(name, in);
        }
    }
}
