package com.vet.scheduling.dto;

import com.vet.scheduling.entity.Appointment;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class CreateAppointmentRequest {

    @NotBlank
    @Size(max = Appointment.MAX_ID_LENGTH)
    private String petId;

    @NotNull
    private Instant start;

    @NotNull
    private Instant end;
}
