package com.scout.core.rootcause;

import com.scout.core.model.ExternalEvent;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable, date-indexed set of known external events. Safe to share across
 * threads.
 *
 * @since 1.0.0
 */
public final class EventCalendar {

    private final String version;
    private final TreeMap<LocalDate, List<ExternalEvent>> byDate;
    private final int size;

    public EventCalendar(String version, List<ExternalEvent> events) {
        this.version = version;
        Objects.requireNonNull(events, "events must not be null");
        TreeMap<LocalDate, List<ExternalEvent>> index = new TreeMap<>();
        for (ExternalEvent e : events) {
            index.computeIfAbsent(e.getDate(), d -> new ArrayList<>()).add(e);
        }
        index.replaceAll((d, list) -> List.copyOf(list));
        this.byDate = index;
        this.size = events.size();
    }

    public static EventCalendar empty() {
        return new EventCalendar("empty", List.of());
    }

    /**
     * Events dated within {@code windowDays} either side of {@code date}.
     *
     * @param date       centre of the window
     * @param windowDays half-width in days
     * @return events ordered by date, then calendar order
     */
    public List<ExternalEvent> around(LocalDate date, int windowDays) {
        return between(date.minusDays(windowDays), date.plusDays(windowDays));
    }

    /**
     * @param from first date, inclusive
     * @param to   last date, inclusive
     * @return events in the range ordered by date
     */
    public List<ExternalEvent> between(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            return List.of();
        }
        List<ExternalEvent> result = new ArrayList<>();
        for (Map.Entry<LocalDate, List<ExternalEvent>> entry : byDate.subMap(from, true, to, true).entrySet()) {
            result.addAll(entry.getValue());
        }
        return Collections.unmodifiableList(result);
    }

    public List<ExternalEvent> all() {
        List<ExternalEvent> result = new ArrayList<>(size);
        byDate.values().forEach(result::addAll);
        result.sort(Comparator.comparing(ExternalEvent::getDate));
        return Collections.unmodifiableList(result);
    }

    public String getVersion() {
        return version;
    }

    public int size() {
        return size;
    }

    @Override
    public String toString() {
        return "EventCalendar{version='" + version + "', events=" + size + '}';
    }
}
