package com.vet.scheduling.event;

/**
 * External consumer of scheduling events (audit trail, notifications).
 * Implementations may throw; failures never affect the scheduling operation.
 */
public interface AppointmentEventSink {

    void accept(AppointmentEvent event);
}
