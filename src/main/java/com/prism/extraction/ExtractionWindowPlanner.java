package com.prism.extraction;

import com.prism.catalog.LogTypeCatalog;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Splits a cache table's refresh range into extraction windows and binds them
 * into compiled extraction queries.
 *
 * The range runs from the last loaded hour (never earlier than the retention
 * horizon) up to the current hour. Wider views pull fewer days per query: each
 * window spans {@code 2^max(4 - columns, 0)} days plus the rest of its start day,
 * so windows end on full daily partitions except the last one.
 */
@Component
public class ExtractionWindowPlanner {

    private final Clock clock;
    private final int retentionDays;

    @Autowired
    public ExtractionWindowPlanner(@Value("${prism.extraction.retention-days:90}") int retentionDays) {
        this(Clock.systemUTC(), retentionDays);
    }

    ExtractionWindowPlanner(Clock clock, int retentionDays) {
        this.clock = clock;
        this.retentionDays = retentionDays;
    }

    /**
     * Plan the windows still to extract.
     *
     * @param lastLoaded end of the last loaded window, or null when nothing is loaded
     * @param cacheColumns the cache table's columns; time-partition columns are not counted
     */
    public List<ExtractionWindow> planWindows(Instant lastLoaded, Collection<String> cacheColumns) {
        Instant thisHour = clock.instant().truncatedTo(ChronoUnit.HOURS);
        Instant horizon = thisHour.minus(Duration.ofDays(retentionDays));
        Instant start = lastLoaded == null || lastLoaded.isBefore(horizon)
            ? horizon
            : lastLoaded.truncatedTo(ChronoUnit.HOURS);

        long columnCount = cacheColumns.stream()
            .filter(column -> !LogTypeCatalog.isTimePartitionColumn(column))
            .count();
        long spanDays = 1L << Math.max(4 - columnCount, 0);

        List<ExtractionWindow> windows = new ArrayList<>();
        while (start.isBefore(thisHour)) {
            int startHour = start.atZone(ZoneOffset.UTC).getHour();
            Instant end = start.plus(Duration.ofDays(spanDays)).plus(Duration.ofHours(23L - startHour));
            if (end.isAfter(thisHour)) {
                end = thisHour;
            }
            windows.add(new ExtractionWindow(start, end));
            start = end;
        }
        return windows;
    }

    /**
     * Replace the window placeholders of a compiled extraction query
     */
    public String bind(String extractionQuery, ExtractionWindow window) {
        return extractionQuery
            .replace(ExtractionQueryCompiler.START_DATE, window.getStartDate())
            .replace(ExtractionQueryCompiler.END_DATE, window.getEndDate())
            .replace(ExtractionQueryCompiler.START_HOUR, Integer.toString(window.getStartHour()))
            .replace(ExtractionQueryCompiler.END_HOUR, Integer.toString(window.getEndHour()));
    }
}
