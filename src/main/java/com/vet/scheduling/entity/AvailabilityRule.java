package com.vet.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Recurring weekly working block of a veterinarian. Several blocks may exist
 * for the same day (e.g. morning and afternoon).
 */
@Entity
@Table(name = "availability_rule", indexes = {
    @Index(name = "idx_rule_vet_day", columnList = "vet_id, day_of_week")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AvailabilityRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vet_id", nullable = false, length = Appointment.MAX_ID_LENGTH)
    private String vetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 9)
    private DayOfWeek dayOfWeek;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "effective_from", nullable = false)
    private LocalDate effectiveFrom;

    /** Inclusive; null means open ended. */
    @Column(name = "effective_until")
    private LocalDate effectiveUntil;

    public boolean appliesTo(LocalDate date) {
        return date.getDayOfWeek() == dayOfWeek
                && !date.isBefore(effectiveFrom)
                && (effectiveUntil == null || !date.isAfter(effectiveUntil));
    }

    public boolean effectiveRangeIntersects(AvailabilityRule other) {
        boolean startsBeforeOtherEnds = other.effectiveUntil == null || !effectiveFrom.isAfter(other.effectiveUntil);
        boolean otherStartsBeforeThisEnds = effectiveUntil == null || !other.effectiveFrom.isAfter(effectiveUntil);
        return startsBeforeOtherEnds && otherStartsBeforeThisEnds;
    }
}
