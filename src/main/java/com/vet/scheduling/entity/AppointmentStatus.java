package com.vet.scheduling.entity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Appointment lifecycle states. SCHEDULED is the only non-terminal state.
 */
public enum AppointmentStatus {
    SCHEDULED,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    private static final Map<AppointmentStatus, Set<AppointmentStatus>> TRANSITIONS =
            new EnumMap<>(AppointmentStatus.class);

    static {
        TRANSITIONS.put(SCHEDULED, Collections.unmodifiableSet(EnumSet.of(COMPLETED, CANCELLED, NO_SHOW)));
        TRANSITIONS.put(COMPLETED, Collections.unmodifiableSet(EnumSet.noneOf(AppointmentStatus.class)));
        TRANSITIONS.put(CANCELLED, Collections.unmodifiableSet(EnumSet.noneOf(AppointmentStatus.class)));
        TRANSITIONS.put(NO_SHOW, Collections.unmodifiableSet(EnumSet.noneOf(AppointmentStatus.class)));
    }

    public boolean canTransitionTo(AppointmentStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<AppointmentStatus> allowedTransitions() {
        return TRANSITIONS.get(this);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }
}
