package com.vet.scheduling.event;

public enum AppointmentOperation {
    CREATED,
    RESCHEDULED,
    CANCELLED,
    COMPLETED,
    NO_SHOW
}
