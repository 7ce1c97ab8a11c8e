package com.vet.scheduling.event;

import com.vet.scheduling.calendar.TimeWindow;
import com.vet.scheduling.entity.Appointment;

import java.time.Instant;

/**
 * Audit/notification record emitted after a successful scheduling change.
 */
public record AppointmentEvent(AppointmentOperation operation,
                               Long appointmentId,
                               String vetId,
                               String petId,
                               TimeWindow interval,
                               Instant timestamp) {

    public static AppointmentEvent of(AppointmentOperation operation, Appointment appointment, Instant timestamp) {
        return new AppointmentEvent(operation, appointment.getId(), appointment.getVetId(), appointment.getPetId(),
                appointment.window(), timestamp);
    }
}
