package com.vet.scheduling.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fire-and-forget fan-out to every {@link AppointmentEventSink}. Called after
 * the scheduling change has committed. Each sink is handed to the task
 * executor separately, so a slow or failing sink neither delays the caller
 * nor other sinks; failures are logged and dropped.
 */
@Component
public class AppointmentEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(AppointmentEventPublisher.class);

    private final List<AppointmentEventSink> sinks;
    private final TaskExecutor executor;

    public AppointmentEventPublisher(List<AppointmentEventSink> sinks, TaskExecutor executor) {
        this.sinks = sinks;
        this.executor = executor;
    }

    public void publish(AppointmentEvent event) {
        for (AppointmentEventSink sink : sinks) {
            try {
                executor.execute(() -> deliver(sink, event));
            } catch (TaskRejectedException e) {
                log.warn("Event dropped, executor saturated: sink={} operation={} appointment={}",
                        sink.getClass().getSimpleName(), event.operation(), event.appointmentId());
            }
        }
    }

    private static void deliver(AppointmentEventSink sink, AppointmentEvent event) {
        try {
            sink.accept(event);
        } catch (RuntimeException e) {
            log.warn("Event delivery failed: sink={} operation={} appointment={}",
                    sink.getClass().getSimpleName(), event.operation(), event.appointmentId(), e);
        }
    }
}
