package com.vet.scheduling.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Optional body of cancel / complete / no-show calls.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class StatusChangeRequest {

    private Long expectedVersion;

    @Size(max = 500)
    private String reason;
}
