package com.vet.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Date-scoped override of the recurring rules: extra time (ADDED) or
 * blocked time such as vacation (REMOVED).
 */
@Entity
@Table(name = "availability_exception", indexes = {
    @Index(name = "idx_exception_vet_date", columnList = "vet_id, exception_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AvailabilityException {

    public enum Kind { ADDED, REMOVED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vet_id", nullable = false, length = Appointment.MAX_ID_LENGTH)
    private String vetId;

    @Column(name = "exception_date", nullable = false)
    private LocalDate exceptionDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Kind kind;

    @Column(length = 255)
    private String reason;
}
