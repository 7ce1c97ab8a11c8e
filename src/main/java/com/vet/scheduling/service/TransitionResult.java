package com.vet.scheduling.service;

import com.vet.scheduling.entity.Appointment;

/**
 * @param changed false when the request was already satisfied (repeated cancel)
 */
public record TransitionResult(Appointment appointment, boolean changed) {
}
