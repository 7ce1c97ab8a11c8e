package com.vet.scheduling.dto;

import com.vet.scheduling.calendar.TimeWindow;

import java.time.Instant;

public record TimeSlotResponse(Instant start, Instant end) {

    public static TimeSlotResponse from(TimeWindow window) {
        return new TimeSlotResponse(window.start(), window.end());
    }
}
