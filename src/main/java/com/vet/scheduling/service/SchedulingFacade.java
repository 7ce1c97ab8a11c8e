package com.vet.scheduling.service;

import com.vet.scheduling.calendar.Intervals;
import com.vet.scheduling.calendar.SchedulingError;
import com.vet.scheduling.calendar.SchedulingException;
import com.vet.scheduling.calendar.TimeWindow;
import com.vet.scheduling.config.SchedulingSettings;
import com.vet.scheduling.entity.Appointment;
import com.vet.scheduling.entity.AppointmentStatus;
import com.vet.scheduling.event.AppointmentEvent;
import com.vet.scheduling.event.AppointmentEventPublisher;
import com.vet.scheduling.event.AppointmentOperation;
import com.vet.scheduling.repository.AppointmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Public scheduling operations. Identifiers are opaque and assumed to be
 * authorized by the caller. Every successful change emits an
 * {@link AppointmentEvent} once it has committed.
 */
@Service
public class SchedulingFacade {

    private static final Logger log = LoggerFactory.getLogger(SchedulingFacade.class);

    private final BookingCoordinator coordinator;
    private final AvailabilityService availabilityService;
    private final AppointmentRepository appointmentRepository;
    private final AppointmentEventPublisher eventPublisher;
    private final SchedulingSettings settings;
    private final Clock clock;

    public SchedulingFacade(BookingCoordinator coordinator,
                            AvailabilityService availabilityService,
                            AppointmentRepository appointmentRepository,
                            AppointmentEventPublisher eventPublisher,
                            SchedulingSettings settings,
                            Clock clock) {
        this.coordinator = coordinator;
        this.availabilityService = availabilityService;
        this.appointmentRepository = appointmentRepository;
        this.eventPublisher = eventPublisher;
        this.settings = settings;
        this.clock = clock;
    }

    // =========================================================
    // WRITES
    // =========================================================
    public Appointment createAppointment(String vetId, String petId, Instant start, Instant end) {
        Appointment appointment = coordinator.create(vetId, petId, start, end);
        publish(AppointmentOperation.CREATED, appointment);
        return appointment;
    }

    public Appointment rescheduleAppointment(Long appointmentId, Instant newStart, Instant newEnd, long expectedVersion) {
        Appointment appointment = coordinator.reschedule(appointmentId, newStart, newEnd, expectedVersion);
        publish(AppointmentOperation.RESCHEDULED, appointment);
        return appointment;
    }

    /**
     * Idempotent: cancelling a cancelled appointment returns it unchanged.
     *
     * @param expectedVersion checked when not null
     */
    public Appointment cancelAppointment(Long appointmentId, Long expectedVersion, String reason) {
        TransitionResult result = coordinator.cancel(appointmentId, expectedVersion, reason);
        if (result.changed()) {
            publish(AppointmentOperation.CANCELLED, result.appointment());
        }
        return result.appointment();
    }

    public Appointment cancelAppointment(Long appointmentId, Long expectedVersion) {
        return cancelAppointment(appointmentId, expectedVersion, null);
    }

    public Appointment completeAppointment(Long appointmentId, Long expectedVersion) {
        TransitionResult result = coordinator.complete(appointmentId, expectedVersion);
        publish(AppointmentOperation.COMPLETED, result.appointment());
        return result.appointment();
    }

    public Appointment markNoShow(Long appointmentId, Long expectedVersion) {
        TransitionResult result = coordinator.markNoShow(appointmentId, expectedVersion);
        publish(AppointmentOperation.NO_SHOW, result.appointment());
        return result.appointment();
    }

    // =========================================================
    // READS
    // =========================================================
    /**
     * Free windows of the vet for the dates {@code [from, to]}: resolved
     * availability minus every scheduled appointment.
     */
    @Transactional(readOnly = true)
    public List<TimeWindow> listAvailableSlots(String vetId, LocalDate from, LocalDate to) {
        validateRange(from, to);
        List<TimeWindow> availability = availabilityService.windowsBetween(vetId, from, to);
        if (availability.isEmpty()) return List.of();

        Instant rangeStart = availability.get(0).start();
        Instant rangeEnd = availability.get(availability.size() - 1).end();
        List<TimeWindow> booked = appointmentRepository
                .findOverlapping(vetId, AppointmentStatus.SCHEDULED, rangeStart, rangeEnd)
                .stream()
                .map(Appointment::window)
                .toList();
        return Intervals.subtractAll(availability, booked);
    }

    /**
     * Free time cut into consecutive bookable slots of {@code slotLength},
     * skipping slots that start before the booking lead time.
     */
    @Transactional(readOnly = true)
    public List<TimeWindow> listAvailableSlots(String vetId, LocalDate from, LocalDate to, Duration slotLength) {
        Duration granularity = settings.getGranularity();
        if (slotLength.isNegative() || slotLength.isZero()
                || slotLength.toNanos() % granularity.toNanos() != 0
                || slotLength.compareTo(settings.getMinDuration()) < 0) {
            throw new SchedulingException(SchedulingError.INVALID_DURATION,
                    "Slot length must be a positive multiple of " + granularity.toMinutes()
                            + " minutes and at least " + settings.getMinDuration().toMinutes() + " minutes");
        }

        Instant earliest = settings.isEnforceLeadTime() ? clock.instant().plus(settings.getBookingLeadTime()) : Instant.MIN;
        List<TimeWindow> slots = new ArrayList<>();
        for (TimeWindow free : listAvailableSlots(vetId, from, to)) {
            for (Instant t = free.start(); !t.plus(slotLength).isAfter(free.end()); t = t.plus(slotLength)) {
                if (t.isBefore(earliest)) continue;
                slots.add(new TimeWindow(t, t.plus(slotLength)));
            }
        }
        log.debug("Generated {} slots of {} for vet {} between {} and {}", slots.size(), slotLength, vetId, from, to);
        return slots;
    }

    @Transactional(readOnly = true)
    public Appointment getAppointment(Long appointmentId) {
        return appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> SchedulingException.notFound(appointmentId));
    }

    /**
     * Appointments of the vet intersecting the dates {@code [from, to]}, optionally by status.
     */
    @Transactional(readOnly = true)
    public List<Appointment> listAppointments(String vetId, LocalDate from, LocalDate to, AppointmentStatus status) {
        validateRange(from, to);
        Instant start = from.atStartOfDay(settings.getZoneId()).toInstant();
        Instant end = to.plusDays(1).atStartOfDay(settings.getZoneId()).toInstant();
        if (status == null) {
            return appointmentRepository.findByVetIdAndStartsAtLessThanAndEndsAtGreaterThanOrderByStartsAtAsc(vetId, end, start);
        }
        return appointmentRepository.findByVetIdAndStatusAndStartsAtLessThanAndEndsAtGreaterThanOrderByStartsAtAsc(
                vetId, status, end, start);
    }

    private void validateRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Both from and to dates are required");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("'to' must not be before 'from'");
        }
        long days = ChronoUnit.DAYS.between(from, to) + 1;
        if (days > settings.getMaxListingDays()) {
            throw new IllegalArgumentException("Date range is limited to " + settings.getMaxListingDays() + " days");
        }
    }

    private void publish(AppointmentOperation operation, Appointment appointment) {
        eventPublisher.publish(AppointmentEvent.of(operation, appointment, clock.instant()));
    }
}
