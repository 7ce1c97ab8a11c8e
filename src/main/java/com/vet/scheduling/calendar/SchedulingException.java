package com.vet.scheduling.calendar;

public class SchedulingException extends RuntimeException {

    private final SchedulingError error;

    public SchedulingException(SchedulingError error, String message) {
        super(message);
        this.error = error;
    }

    public SchedulingException(SchedulingError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public SchedulingError getError() {
        return error;
    }

    public static SchedulingException notFound(Long appointmentId) {
        return new SchedulingException(SchedulingError.NOT_FOUND, "Appointment not found: " + appointmentId);
    }
}
