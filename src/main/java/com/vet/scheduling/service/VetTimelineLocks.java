package com.vet.scheduling.service;

import com.vet.scheduling.calendar.SchedulingError;
import com.vet.scheduling.calendar.SchedulingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process mutual exclusion per veterinarian timeline. Different vets never
 * contend; waiting is bounded and a timeout surfaces as {@link SchedulingError#BUSY}.
 */
@Component
public class VetTimelineLocks {

    private static final Logger log = LoggerFactory.getLogger(VetTimelineLocks.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String vetId, Duration timeout, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(vetId, id -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchedulingException(SchedulingError.BUSY, "Interrupted while waiting for the calendar", e);
        }
        if (!acquired) {
            log.warn("Timeline lock timeout: vet={} waited={}ms", vetId, timeout.toMillis());
            throw new SchedulingException(SchedulingError.BUSY, "Calendar is busy, try again later");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
