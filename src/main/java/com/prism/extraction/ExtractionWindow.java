package com.prism.extraction;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * One extraction time window, on UTC hour boundaries. Start is exclusive, end inclusive.
 */
public class ExtractionWindow {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Instant start;
    private final Instant end;

    public ExtractionWindow(Instant start, Instant end) {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Window end must be after start: " + start + " / " + end);
        }
        this.start = start;
        this.end = end;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public String getStartDate() {
        return DATE_FORMATTER.format(utc(start));
    }

    public String getEndDate() {
        return DATE_FORMATTER.format(utc(end));
    }

    public int getStartHour() {
        return utc(start).getHour();
    }

    public int getEndHour() {
        return utc(end).getHour();
    }

    private static ZonedDateTime utc(Instant instant) {
        return instant.atZone(ZoneOffset.UTC);
    }

    @Override
    public String toString() {
        return "(" + start + ", " + end + "]";
    }
}
