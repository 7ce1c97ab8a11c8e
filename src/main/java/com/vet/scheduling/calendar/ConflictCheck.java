package com.vet.scheduling.calendar;

/**
 * Outcome of a read-only booking pre-check.
 */
public record ConflictCheck(boolean ok, SchedulingError error, String message) {

    private static final ConflictCheck PASSED = new ConflictCheck(true, null, null);

    public static ConflictCheck passed() {
        return PASSED;
    }

    public static ConflictCheck failed(SchedulingError error, String message) {
        return new ConflictCheck(false, error, message);
    }

    public void orThrow() {
        if (!ok) {
            throw new SchedulingException(error, message);
        }
    }
}
