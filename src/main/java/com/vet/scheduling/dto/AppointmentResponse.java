package com.vet.scheduling.dto;

import com.vet.scheduling.entity.Appointment;
import com.vet.scheduling.entity.AppointmentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentResponse {

    private Long id;
    private String vetId;
    private String petId;
    private Instant start;
    private Instant end;
    private AppointmentStatus status;
    private Long version;
    private Instant createdAt;
    private Instant lastModifiedAt;
    private String cancellationReason;

    public static AppointmentResponse from(Appointment a) {
        return AppointmentResponse.builder()
                .id(a.getId())
                .vetId(a.getVetId())
                .petId(a.getPetId())
                .start(a.getStartsAt())
                .end(a.getEndsAt())
                .status(a.getStatus())
                .version(a.getVersion())
                .createdAt(a.getCreatedAt())
                .lastModifiedAt(a.getLastModifiedAt())
                .cancellationReason(a.getCancellationReason())
                .build();
    }
}
