package com.vet.scheduling.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

import java.time.Instant;

@TestConfiguration
public class TestSchedulingConfig {

    /** Saturday 2031-03-01, before every date the tests book. */
    public static final Instant START = Instant.parse("2031-03-01T00:00:00Z");

    @Bean
    @Primary
    public MutableClock testClock() {
        return new MutableClock(START);
    }

    /** Delivers events on the calling thread so assertions see them immediately. */
    @Bean
    public TaskExecutor eventTaskExecutor() {
        return new SyncTaskExecutor();
    }

    @Bean
    public RecordingEventSink recordingEventSink() {
        return new RecordingEventSink();
    }
}
