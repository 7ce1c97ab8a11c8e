package com.vet.scheduling.service;

import com.vet.scheduling.config.SchedulingSettings;
import com.vet.scheduling.entity.VetCalendar;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Storage-level lock on a veterinarian's calendar row, held until the
 * surrounding transaction ends. The row is created on first use; losing a
 * concurrent first insert surfaces as {@link ConcurrencyFailureException} so
 * the caller retries against the row the other writer created.
 */
@Repository
public class VetCalendarLocker {

    private static final Logger log = LoggerFactory.getLogger(VetCalendarLocker.class);

    private static final String LOCK_TIMEOUT_HINT = "jakarta.persistence.lock.timeout";

    @PersistenceContext
    private EntityManager entityManager;

    private final SchedulingSettings settings;

    public VetCalendarLocker(SchedulingSettings settings) {
        this.settings = settings;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public VetCalendar lock(String vetId) {
        Map<String, Object> hints = Map.of(LOCK_TIMEOUT_HINT, settings.getLockTimeout().toMillis());
        VetCalendar calendar = entityManager.find(VetCalendar.class, vetId, LockModeType.PESSIMISTIC_WRITE, hints);
        if (calendar == null) {
            calendar = VetCalendar.builder().vetId(vetId).build();
            try {
                entityManager.persist(calendar);
                entityManager.flush();
            } catch (PersistenceException e) {
                log.info("Calendar for vet {} was created concurrently", vetId);
                throw new ConcurrencyFailureException("Calendar for vet " + vetId + " was created concurrently", e);
            }
            log.info("Created calendar for vet {}", vetId);
        }
        return calendar;
    }
}
