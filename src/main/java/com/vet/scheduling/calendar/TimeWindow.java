package com.vet.scheduling.calendar;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time range {@code [start, end)}. Zero-length and inverted windows
 * are rejected on construction.
 *
 * @param start inclusive
 * @param end exclusive
 */
public record TimeWindow(Instant start, Instant end) implements Comparable<TimeWindow> {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Window start must be before end: " + start + " / " + end);
        }
    }

    @Override
    public int compareTo(TimeWindow other) {
        int byStart = start.compareTo(other.start);
        return byStart != 0 ? byStart : end.compareTo(other.end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
