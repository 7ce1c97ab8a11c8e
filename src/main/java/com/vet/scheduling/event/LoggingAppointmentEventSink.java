package com.vet.scheduling.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes each event as one JSON line to the {@code scheduling.audit} logger.
 */
@Component
public class LoggingAppointmentEventSink implements AppointmentEventSink {

    private static final Logger audit = LoggerFactory.getLogger("scheduling.audit");

    private final ObjectMapper objectMapper;

    public LoggingAppointmentEventSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void accept(AppointmentEvent event) {
        try {
            audit.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            audit.info("{}", event);
        }
    }
}
