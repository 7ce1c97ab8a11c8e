package com.vet.scheduling.calendar;

import com.vet.scheduling.config.SchedulingSettings;
import com.vet.scheduling.entity.AvailabilityException;
import com.vet.scheduling.entity.AvailabilityRule;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Derives the nominally bookable windows of one calendar date from recurring
 * rules and date-scoped exceptions. Pure: callers supply the rules and
 * exceptions, nothing is read from storage here.
 *
 * <p>Order of application: matching rules are unioned, REMOVED exceptions are
 * cut out, ADDED exceptions are unioned back in, and the result is coalesced.
 * A time of day of {@code 00:00} used as an end means the end of the date.
 */
@Component
public class AvailabilityResolver {

    private final ZoneId zoneId;

    public AvailabilityResolver(SchedulingSettings settings) {
        this.zoneId = settings.getZoneId();
    }

    public List<TimeWindow> resolve(LocalDate date,
                                    Collection<AvailabilityRule> rules,
                                    Collection<AvailabilityException> exceptions) {
        List<TimeWindow> fromRules = new ArrayList<>();
        for (AvailabilityRule rule : rules) {
            if (rule.appliesTo(date)) {
                toWindow(date, rule.getStartTime(), rule.getEndTime()).ifPresent(fromRules::add);
            }
        }

        List<TimeWindow> removed = new ArrayList<>();
        List<TimeWindow> added = new ArrayList<>();
        for (AvailabilityException ex : exceptions) {
            if (!date.equals(ex.getExceptionDate())) continue;
            Optional<TimeWindow> window = toWindow(date, ex.getStartTime(), ex.getEndTime());
            if (window.isEmpty()) continue;
            if (ex.getKind() == AvailabilityException.Kind.REMOVED) {
                removed.add(window.get());
            } else {
                added.add(window.get());
            }
        }

        List<TimeWindow> windows = Intervals.subtractAll(fromRules, removed);
        return Intervals.union(windows, added);
    }

    private Optional<TimeWindow> toWindow(LocalDate date, LocalTime start, LocalTime end) {
        Instant from = date.atTime(start).atZone(zoneId).toInstant();
        Instant to = LocalTime.MIDNIGHT.equals(end)
                ? date.plusDays(1).atStartOfDay(zoneId).toInstant()
                : date.atTime(end).atZone(zoneId).toInstant();
        // a DST shift can collapse a short local window
        if (!from.isBefore(to)) return Optional.empty();
        return Optional.of(new TimeWindow(from, to));
    }
}
