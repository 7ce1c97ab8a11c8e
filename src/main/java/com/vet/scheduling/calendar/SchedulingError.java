package com.vet.scheduling.calendar;

/**
 * Expected, recoverable outcomes of a scheduling operation.
 */
public enum SchedulingError {
    INVALID_DURATION,
    INVALID_WINDOW,
    OUTSIDE_AVAILABILITY,
    SLOT_UNAVAILABLE,
    CONCURRENT_MODIFICATION,
    INVALID_TRANSITION,
    NOT_FOUND,
    /** Lock timeout or exhausted retries on transient storage failures; the caller may retry later. */
    BUSY
}
