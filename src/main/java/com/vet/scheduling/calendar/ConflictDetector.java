package com.vet.scheduling.calendar;

import com.vet.scheduling.config.SchedulingSettings;
import com.vet.scheduling.entity.Appointment;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Read-only validation of a proposed appointment interval. It never reserves
 * anything: a passing check has to be repeated under the timeline lock
 * before the write.
 */
@Component
public class ConflictDetector {

    private final SchedulingSettings settings;
    private final Clock clock;

    public ConflictDetector(SchedulingSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Shape checks only: ordering, granularity, minimum length and lead time.
     */
    public ConflictCheck checkShape(Instant start, Instant end, boolean enforceLeadTime) {
        if (start == null || end == null || !start.isBefore(end)) {
            return ConflictCheck.failed(SchedulingError.INVALID_DURATION, "Start must be before end");
        }

        Duration granularity = settings.getGranularity();
        if (!isAligned(start) || !isAligned(end)) {
            return ConflictCheck.failed(SchedulingError.INVALID_DURATION,
                    "Start and end must align to " + granularity.toMinutes() + "-minute increments");
        }

        Duration duration = Duration.between(start, end);
        if (duration.toNanos() % granularity.toNanos() != 0) {
            return ConflictCheck.failed(SchedulingError.INVALID_DURATION,
                    "Duration must be a multiple of " + granularity.toMinutes() + " minutes");
        }
        if (duration.compareTo(settings.getMinDuration()) < 0) {
            return ConflictCheck.failed(SchedulingError.INVALID_DURATION,
                    "Duration must be at least " + settings.getMinDuration().toMinutes() + " minutes");
        }

        if (enforceLeadTime) {
            Instant earliest = clock.instant().plus(settings.getBookingLeadTime());
            if (start.isBefore(earliest)) {
                return ConflictCheck.failed(SchedulingError.INVALID_WINDOW,
                        "Appointments must start at or after " + earliest);
            }
        }
        return ConflictCheck.passed();
    }

    /**
     * Full pre-check of {@code [start, end)} against the resolved availability
     * of the covered dates and the vet's scheduled appointments.
     *
     * @param excludeAppointmentId appointment being rescheduled, ignored in the overlap set; may be null
     */
    public ConflictCheck check(Instant start,
                               Instant end,
                               Collection<TimeWindow> availability,
                               Collection<Appointment> scheduled,
                               Long excludeAppointmentId,
                               boolean enforceLeadTime) {
        ConflictCheck shape = checkShape(start, end, enforceLeadTime);
        if (!shape.ok()) return shape;

        TimeWindow proposed = new TimeWindow(start, end);
        if (!Intervals.containedInAny(Intervals.coalesce(availability), proposed)) {
            return ConflictCheck.failed(SchedulingError.OUTSIDE_AVAILABILITY,
                    "Requested time " + proposed + " is outside the veterinarian's availability");
        }

        for (Appointment existing : scheduled) {
            if (!existing.isScheduled()) continue;
            if (excludeAppointmentId != null && Objects.equals(existing.getId(), excludeAppointmentId)) continue;
            if (Intervals.overlaps(existing.window(), proposed)) {
                return ConflictCheck.failed(SchedulingError.SLOT_UNAVAILABLE,
                        "Requested time " + proposed + " overlaps an existing appointment");
            }
        }
        return ConflictCheck.passed();
    }

    /**
     * Calendar dates, in the clinic zone, touched by {@code [start, end)}.
     */
    public List<LocalDate> coveredDates(Instant start, Instant end) {
        LocalDate first = start.atZone(settings.getZoneId()).toLocalDate();
        LocalDate last = end.minusNanos(1).atZone(settings.getZoneId()).toLocalDate();
        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = first; !d.isAfter(last); d = d.plusDays(1)) {
            dates.add(d);
        }
        return dates;
    }

    private boolean isAligned(Instant instant) {
        ZonedDateTime local = instant.atZone(settings.getZoneId());
        long nanoOfDay = local.toLocalTime().toNanoOfDay();
        return nanoOfDay % settings.getGranularity().toNanos() == 0;
    }
}
