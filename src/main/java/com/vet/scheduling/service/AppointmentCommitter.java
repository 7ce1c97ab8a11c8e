package com.vet.scheduling.service;

import com.vet.scheduling.calendar.SchedulingError;
import com.vet.scheduling.calendar.SchedulingException;
import com.vet.scheduling.calendar.TimeWindow;
import com.vet.scheduling.entity.Appointment;
import com.vet.scheduling.entity.AppointmentStatus;
import com.vet.scheduling.entity.VetCalendar;
import com.vet.scheduling.repository.AppointmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The write half of each booking operation, one transaction per call. Overlap
 * is re-checked here under the calendar row lock, so detection and write
 * share one atomicity boundary.
 */
@Service
public class AppointmentCommitter {

    private static final Logger log = LoggerFactory.getLogger(AppointmentCommitter.class);

    private final AppointmentRepository appointmentRepository;
    private final VetCalendarLocker calendarLocker;
    private final AppointmentStateMachine stateMachine;
    private final Clock clock;

    public AppointmentCommitter(AppointmentRepository appointmentRepository,
                                VetCalendarLocker calendarLocker,
                                AppointmentStateMachine stateMachine,
                                Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.calendarLocker = calendarLocker;
        this.stateMachine = stateMachine;
        this.clock = clock;
    }

    @Transactional
    public Appointment insert(String vetId, String petId, TimeWindow window) {
        VetCalendar calendar = calendarLocker.lock(vetId);

        List<Appointment> overlapping = appointmentRepository.findOverlapping(
                vetId, AppointmentStatus.SCHEDULED, window.start(), window.end());
        if (!overlapping.isEmpty()) {
            throw new CommitConflictException("Interval " + window + " taken by appointment " + overlapping.get(0).getId());
        }

        Instant now = clock.instant();
        Appointment appointment = Appointment.builder()
                .vetId(vetId)
                .petId(petId)
                .startsAt(window.start())
                .endsAt(window.end())
                .status(AppointmentStatus.SCHEDULED)
                .createdAt(now)
                .lastModifiedAt(now)
                .build();
        appointment = appointmentRepository.saveAndFlush(appointment);
        calendar.setLastChangedAt(now);

        log.info("Booked appointment: id={} vet={} pet={} window={}", appointment.getId(), vetId, petId, window);
        return appointment;
    }

    @Transactional
    public Appointment reschedule(Long appointmentId, String vetId, TimeWindow window, long expectedVersion) {
        VetCalendar calendar = calendarLocker.lock(vetId);

        Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> SchedulingException.notFound(appointmentId));
        stateMachine.requireReschedulable(appointment);
        requireVersion(appointment, expectedVersion);

        List<Appointment> overlapping = appointmentRepository.findOverlapping(
                vetId, AppointmentStatus.SCHEDULED, window.start(), window.end());
        for (Appointment other : overlapping) {
            if (!other.getId().equals(appointmentId)) {
                throw new CommitConflictException("Interval " + window + " taken by appointment " + other.getId());
            }
        }

        TimeWindow previous = appointment.window();
        Instant now = clock.instant();
        appointment.setStartsAt(window.start());
        appointment.setEndsAt(window.end());
        appointment.setLastModifiedAt(now);
        appointment = appointmentRepository.saveAndFlush(appointment);
        calendar.setLastChangedAt(now);

        log.info("Rescheduled appointment {} from {} to {}", appointmentId, previous, window);
        return appointment;
    }

    /**
     * Status-only change under the appointment row lock. A repeated cancel is
     * answered with the current state and no version check.
     */
    @Transactional
    public TransitionResult transition(Long appointmentId, AppointmentStatus target, Long expectedVersion, String reason) {
        Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> SchedulingException.notFound(appointmentId));

        if (target == AppointmentStatus.CANCELLED && appointment.getStatus() == AppointmentStatus.CANCELLED) {
            log.debug("Appointment {} already cancelled", appointmentId);
            return new TransitionResult(appointment, false);
        }
        Instant now = clock.instant();
        stateMachine.requireAllowed(appointment, target, now);
        if (expectedVersion != null) {
            requireVersion(appointment, expectedVersion);
        }

        stateMachine.apply(appointment, target, now);
        if (target == AppointmentStatus.CANCELLED) {
            appointment.setCancellationReason(reason);
        }
        appointment = appointmentRepository.saveAndFlush(appointment);

        log.info("Appointment {} -> {} (vet={})", appointmentId, target, appointment.getVetId());
        return new TransitionResult(appointment, true);
    }

    private static void requireVersion(Appointment appointment, long expectedVersion) {
        if (!Objects.equals(appointment.getVersion(), expectedVersion)) {
            throw new SchedulingException(SchedulingError.CONCURRENT_MODIFICATION,
                    "Appointment " + appointment.getId() + " is at version " + appointment.getVersion()
                            + ", expected " + expectedVersion);
        }
    }
}
