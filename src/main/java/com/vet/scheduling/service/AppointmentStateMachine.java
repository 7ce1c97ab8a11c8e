package com.vet.scheduling.service;

import com.vet.scheduling.calendar.SchedulingError;
import com.vet.scheduling.calendar.SchedulingException;
import com.vet.scheduling.entity.Appointment;
import com.vet.scheduling.entity.AppointmentStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Applies lifecycle transitions using the table in {@link AppointmentStatus}.
 * Cancellation is only possible before the visit starts; completion and
 * no-show only once it has started.
 * The version bump happens when the change is flushed.
 */
@Component
public class AppointmentStateMachine {

    public void apply(Appointment appointment, AppointmentStatus target, Instant now) {
        requireAllowed(appointment, target, now);
        appointment.setStatus(target);
        appointment.setLastModifiedAt(now);
    }

    public void requireAllowed(Appointment appointment, AppointmentStatus target, Instant now) {
        AppointmentStatus current = appointment.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new SchedulingException(SchedulingError.INVALID_TRANSITION,
                    "Cannot move appointment " + appointment.getId() + " from " + current + " to " + target);
        }
        if (target == AppointmentStatus.CANCELLED && !now.isBefore(appointment.getStartsAt())) {
            throw new SchedulingException(SchedulingError.INVALID_TRANSITION,
                    "Appointment " + appointment.getId() + " has already started; mark it completed or no-show instead");
        }
        if ((target == AppointmentStatus.COMPLETED || target == AppointmentStatus.NO_SHOW)
                && now.isBefore(appointment.getStartsAt())) {
            throw new SchedulingException(SchedulingError.INVALID_TRANSITION,
                    "Appointment " + appointment.getId() + " has not started yet; cannot mark it " + target);
        }
    }

    /**
     * Rescheduling keeps the appointment SCHEDULED; it is only allowed from there.
     */
    public void requireReschedulable(Appointment appointment) {
        if (!appointment.isScheduled()) {
            throw new SchedulingException(SchedulingError.INVALID_TRANSITION,
                    "Appointment " + appointment.getId() + " is " + appointment.getStatus() + " and cannot be rescheduled");
        }
    }
}
