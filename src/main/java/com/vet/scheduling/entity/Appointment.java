package com.vet.scheduling.entity;

import com.vet.scheduling.calendar.TimeWindow;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "appointment", indexes = {
    @Index(name = "idx_appointment_vet_status_start", columnList = "vet_id, status, starts_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    /** Column width of the opaque veterinarian and pet identifiers. */
    public static final int MAX_ID_LENGTH = 64;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vet_id", nullable = false, length = MAX_ID_LENGTH)
    private String vetId;

    @Column(name = "pet_id", nullable = false, length = MAX_ID_LENGTH)
    private String petId;

    /** Inclusive. */
    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    /** Exclusive. */
    @Column(name = "ends_at", nullable = false)
    private Instant endsAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private AppointmentStatus status = AppointmentStatus.SCHEDULED;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_modified_at", nullable = false)
    private Instant lastModifiedAt;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    public TimeWindow window() {
        return new TimeWindow(startsAt, endsAt);
    }

    public boolean isScheduled() {
        return status == AppointmentStatus.SCHEDULED;
    }
}
