package com.vet.scheduling.service;

import com.vet.scheduling.calendar.ConflictCheck;
import com.vet.scheduling.calendar.ConflictDetector;
import com.vet.scheduling.calendar.SchedulingError;
import com.vet.scheduling.calendar.SchedulingException;
import com.vet.scheduling.calendar.TimeWindow;
import com.vet.scheduling.config.SchedulingSettings;
import com.vet.scheduling.entity.Appointment;
import com.vet.scheduling.entity.AppointmentStatus;
import com.vet.scheduling.repository.AppointmentRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Check-then-commit for every write to a veterinarian's timeline.
 *
 * <p>Each attempt runs the read-only pre-check without any lock, then takes
 * the vet's timeline lock and commits in one transaction that re-validates
 * overlap under the calendar row lock. A commit that loses the race is
 * retried against fresh state; lock timeouts and other
 * {@link ConcurrencyFailureException}s are retried too. Constraint violations
 * are permanent and propagate unchanged.
 * Attempts are bounded by {@code scheduling.max-attempts}.
 */
@Service
public class BookingCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BookingCoordinator.class);

    private final AppointmentRepository appointmentRepository;
    private final AvailabilityService availabilityService;
    private final ConflictDetector conflictDetector;
    private final AppointmentCommitter committer;
    private final VetTimelineLocks timelineLocks;
    private final SchedulingSettings settings;

    public BookingCoordinator(AppointmentRepository appointmentRepository,
                              AvailabilityService availabilityService,
                              ConflictDetector conflictDetector,
                              AppointmentCommitter committer,
                              VetTimelineLocks timelineLocks,
                              SchedulingSettings settings) {
        this.appointmentRepository = appointmentRepository;
        this.availabilityService = availabilityService;
        this.conflictDetector = conflictDetector;
        this.committer = committer;
        this.timelineLocks = timelineLocks;
        this.settings = settings;
    }

    // =========================================================
    // CREATE
    // =========================================================
    public Appointment create(String vetId, String petId, Instant start, Instant end) {
        requireId(vetId, "vetId");
        requireId(petId, "petId");

        boolean lostRace = false;
        for (int attempt = 1; attempt <= settings.getMaxAttempts(); attempt++) {
            precheck(vetId, start, end, null, settings.isEnforceLeadTime()).orThrow();
            TimeWindow window = new TimeWindow(start, end);
            try {
                return timelineLocks.withLock(vetId, settings.getLockTimeout(),
                        () -> committer.insert(vetId, petId, window));
            } catch (CommitConflictException e) {
                lostRace = true;
                log.info("Create lost race on attempt {}/{}: vet={} {}", attempt, settings.getMaxAttempts(), vetId, e.getMessage());
            } catch (ConcurrencyFailureException e) {
                lostRace = false;
                logTransient("create", attempt, vetId, e);
            }
        }
        throw exhausted(lostRace, "create", vetId);
    }

    // =========================================================
    // RESCHEDULE
    // =========================================================
    public Appointment reschedule(Long appointmentId, Instant start, Instant end, long expectedVersion) {
        boolean enforceLeadTime = settings.isEnforceLeadTime() && settings.isRescheduleEnforcesLeadTime();

        boolean lostRace = false;
        String vetId = null;
        for (int attempt = 1; attempt <= settings.getMaxAttempts(); attempt++) {
            Appointment current = appointmentRepository.findById(appointmentId)
                    .orElseThrow(() -> SchedulingException.notFound(appointmentId));
            if (!current.isScheduled()) {
                throw new SchedulingException(SchedulingError.INVALID_TRANSITION,
                        "Appointment " + appointmentId + " is " + current.getStatus() + " and cannot be rescheduled");
            }
            if (!Objects.equals(current.getVersion(), expectedVersion)) {
                throw new SchedulingException(SchedulingError.CONCURRENT_MODIFICATION,
                        "Appointment " + appointmentId + " is at version " + current.getVersion() + ", expected " + expectedVersion);
            }

            vetId = current.getVetId();
            precheck(vetId, start, end, appointmentId, enforceLeadTime).orThrow();
            TimeWindow window = new TimeWindow(start, end);
            String lockedVet = vetId;
            try {
                return timelineLocks.withLock(lockedVet, settings.getLockTimeout(),
                        () -> committer.reschedule(appointmentId, lockedVet, window, expectedVersion));
            } catch (CommitConflictException e) {
                lostRace = true;
                log.info("Reschedule of {} lost race on attempt {}/{}: {}", appointmentId, attempt, settings.getMaxAttempts(), e.getMessage());
            } catch (ConcurrencyFailureException e) {
                lostRace = false;
                logTransient("reschedule", attempt, vetId, e);
            }
        }
        throw exhausted(lostRace, "reschedule", vetId);
    }

    // =========================================================
    // STATUS TRANSITIONS
    // =========================================================
    public TransitionResult cancel(Long appointmentId, Long expectedVersion, String reason) {
        return transition(appointmentId, AppointmentStatus.CANCELLED, expectedVersion, reason);
    }

    public TransitionResult complete(Long appointmentId, Long expectedVersion) {
        return transition(appointmentId, AppointmentStatus.COMPLETED, expectedVersion, null);
    }

    public TransitionResult markNoShow(Long appointmentId, Long expectedVersion) {
        return transition(appointmentId, AppointmentStatus.NO_SHOW, expectedVersion, null);
    }

    /**
     * Status changes never touch the timeline lock: freeing or closing an
     * interval cannot create an overlap.
     */
    private TransitionResult transition(Long appointmentId, AppointmentStatus target, Long expectedVersion, String reason) {
        for (int attempt = 1; attempt <= settings.getMaxAttempts(); attempt++) {
            try {
                return committer.transition(appointmentId, target, expectedVersion, reason);
            } catch (ConcurrencyFailureException e) {
                logTransient(target.name().toLowerCase(), attempt, null, e);
            }
        }
        throw new SchedulingException(SchedulingError.BUSY,
                "Could not update appointment " + appointmentId + ", try again later");
    }

    // =========================================================
    // PRE-CHECK
    // =========================================================
    /**
     * Read-only check against current availability and bookings. Takes no lock.
     */
    public ConflictCheck precheck(String vetId, Instant start, Instant end, Long excludeAppointmentId, boolean enforceLeadTime) {
        ConflictCheck shape = conflictDetector.checkShape(start, end, enforceLeadTime);
        if (!shape.ok()) return shape;

        List<LocalDate> dates = conflictDetector.coveredDates(start, end);
        List<TimeWindow> availability = new ArrayList<>(
                availabilityService.windowsBetween(vetId, dates.get(0), dates.get(dates.size() - 1)));
        List<Appointment> scheduled = appointmentRepository.findOverlapping(vetId, AppointmentStatus.SCHEDULED, start, end);
        return conflictDetector.check(start, end, availability, scheduled, excludeAppointmentId, enforceLeadTime);
    }

    private SchedulingException exhausted(boolean lostRace, String operation, String vetId) {
        if (lostRace) {
            log.info("{} gave up after {} attempts, slot taken: vet={}", operation, settings.getMaxAttempts(), vetId);
            return new SchedulingException(SchedulingError.SLOT_UNAVAILABLE, "Requested time is no longer available");
        }
        log.warn("{} gave up after {} attempts on storage failures: vet={}", operation, settings.getMaxAttempts(), vetId);
        return new SchedulingException(SchedulingError.BUSY, "Calendar is busy, try again later");
    }

    private void logTransient(String operation, int attempt, String vetId, RuntimeException e) {
        log.warn("Transient failure during {} (attempt {}/{}, vet={}): {}",
                operation, attempt, settings.getMaxAttempts(), vetId, e.getMessage());
    }

    private static void requireId(String value, String name) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (value.length() > Appointment.MAX_ID_LENGTH) {
            throw new IllegalArgumentException(name + " must be at most " + Appointment.MAX_ID_LENGTH + " characters");
        }
    }
}
