package com.vet.scheduling.calendar;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Stateless operations over half-open {@link TimeWindow}s. Windows that only
 * touch ({@code a.end == b.start}) do not overlap, but they are merged by
 * {@link #coalesce(Collection)}.
 */
public final class Intervals {

    private Intervals() {
    }

    public static boolean overlaps(TimeWindow a, TimeWindow b) {
        return a.start().isBefore(b.end()) && b.start().isBefore(a.end());
    }

    public static boolean contains(TimeWindow window, TimeWindow interval) {
        return !interval.start().isBefore(window.start()) && !interval.end().isAfter(window.end());
    }

    /**
     * True when a single window of {@code windows} holds the whole interval.
     * An interval bridging a gap between two windows is not contained.
     */
    public static boolean containedInAny(Collection<TimeWindow> windows, TimeWindow interval) {
        for (TimeWindow w : windows) {
            if (contains(w, interval)) return true;
        }
        return false;
    }

    /**
     * Remaining parts of {@code window} once every blocked interval is cut out,
     * ascending and non-overlapping.
     */
    public static List<TimeWindow> subtract(TimeWindow window, Collection<TimeWindow> blocked) {
        if (blocked.isEmpty()) return List.of(window);

        List<TimeWindow> sorted = new ArrayList<>(blocked);
        Collections.sort(sorted);

        List<TimeWindow> remaining = new ArrayList<>();
        Instant cursor = window.start();
        for (TimeWindow b : sorted) {
            if (!b.end().isAfter(cursor)) continue;
            if (!b.start().isBefore(window.end())) break;
            if (b.start().isAfter(cursor)) {
                remaining.add(new TimeWindow(cursor, b.start()));
            }
            cursor = b.end();
            if (!cursor.isBefore(window.end())) break;
        }
        if (cursor.isBefore(window.end())) {
            remaining.add(new TimeWindow(cursor, window.end()));
        }
        return remaining;
    }

    public static List<TimeWindow> subtractAll(Collection<TimeWindow> windows, Collection<TimeWindow> blocked) {
        List<TimeWindow> result = new ArrayList<>();
        for (TimeWindow w : coalesce(windows)) {
            result.addAll(subtract(w, blocked));
        }
        return result;
    }

    /**
     * Merges overlapping or adjacent windows into maximal windows, sorted by start.
     */
    public static List<TimeWindow> coalesce(Collection<TimeWindow> windows) {
        if (windows.isEmpty()) return List.of();

        List<TimeWindow> sorted = new ArrayList<>(windows);
        Collections.sort(sorted);

        List<TimeWindow> merged = new ArrayList<>();
        Instant start = sorted.get(0).start();
        Instant end = sorted.get(0).end();
        for (int i = 1; i < sorted.size(); i++) {
            TimeWindow next = sorted.get(i);
            if (!next.start().isAfter(end)) {
                if (next.end().isAfter(end)) end = next.end();
            } else {
                merged.add(new TimeWindow(start, end));
                start = next.start();
                end = next.end();
            }
        }
        merged.add(new TimeWindow(start, end));
        return merged;
    }

    public static List<TimeWindow> union(Collection<TimeWindow> a, Collection<TimeWindow> b) {
        List<TimeWindow> all = new ArrayList<>(a.size() + b.size());
        all.addAll(a);
        all.addAll(b);
        return coalesce(all);
    }
}
