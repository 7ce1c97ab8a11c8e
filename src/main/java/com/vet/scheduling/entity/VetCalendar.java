package com.vet.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One row per veterinarian. Writers lock this row to serialize changes to the
 * veterinarian's timeline.
 */
@Entity
@Table(name = "vet_calendar")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VetCalendar {

    @Id
    @Column(name = "vet_id", length = Appointment.MAX_ID_LENGTH)
    private String vetId;

    @Column(name = "last_changed_at")
    private Instant lastChangedAt;
}
