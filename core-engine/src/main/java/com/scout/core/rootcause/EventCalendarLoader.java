package com.scout.core.rootcause;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scout.core.model.ExternalEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads the versioned external event calendar from JSON.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CALENDAR_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <pre>
 * {
 *   "version": "2025.09",
 *   "events": [
 *     { "date": "2024-11-29", "event_type": "holiday", "name": "Black Friday",
 *       "impact_level": "critical", "affected_metrics": ["sessions", "conversions"],
 *       "typical_duration_days": 3, "confidence_boost": 0.95 }
 *   ]
 * }
 * </pre>
 *
 * <p>
 * Every event is validated; the loader fails fast on the first invalid
 * calendar with all of its errors.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventCalendarLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EventCalendarLoader.class);

    public static final String ENV_CALENDAR_PATH = "SCOUT_EVENT_CALENDAR_PATH";
    public static final String DEFAULT_RESOURCE = "event-calendar.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private EventCalendarLoader() {
        // utility class
    }

    public static EventCalendar load() {
        return load(System.getenv(ENV_CALENDAR_PATH));
    }

    /**
     * @param explicitPath calendar file, used when it exists; otherwise the classpath default
     * @return validated calendar
     */
    public static EventCalendar load(String explicitPath) {
        if (explicitPath != null && !explicitPath.isBlank() && Files.exists(Path.of(explicitPath))) {
            LOG.info("Loading event calendar from path: {}", explicitPath);
            return fromFile(explicitPath);
        }
        LOG.info("Loading event calendar from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static EventCalendar fromFile(String path) {
        Objects.requireNonNull(path, "Calendar file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Event calendar not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read event calendar: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static EventCalendar fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = EventCalendarLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static EventCalendar parseAndValidate(InputStream is, String source) throws IOException {
        CalendarDocument document;
        try {
            document = MAPPER.readValue(is, CalendarDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid event calendar " + source + ": " + e.getOriginalMessage(), e);
        }
        if (document == null || document.events == null) {
            LOG.warn("Event calendar {} defines no events", source);
            return new EventCalendar(document == null ? null : document.version, List.of());
        }

        List<String> errors = new ArrayList<>();
        for (int i = 0; i < document.events.size(); i++) {
            ExternalEvent event = document.events.get(i);
            if (event == null) {
                errors.add("Event at index " + i + " is null");
                continue;
            }
            try {
                event.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Event calendar validation failed:\n  - "
                    + String.join("\n  - ", errors));
        }

        EventCalendar calendar = new EventCalendar(document.version, document.events);
        LOG.info("Loaded {}", calendar);
        return calendar;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CalendarDocument {
        public String version;
        public List<ExternalEvent> events;
    }
}
