package com.vet.scheduling.service;

import com.vet.scheduling.calendar.AvailabilityResolver;
import com.vet.scheduling.calendar.Intervals;
import com.vet.scheduling.calendar.SchedulingError;
import com.vet.scheduling.calendar.SchedulingException;
import com.vet.scheduling.calendar.TimeWindow;
import com.vet.scheduling.config.SchedulingSettings;
import com.vet.scheduling.entity.Appointment;
import com.vet.scheduling.entity.AvailabilityException;
import com.vet.scheduling.entity.AvailabilityRule;
import com.vet.scheduling.repository.AvailabilityExceptionRepository;
import com.vet.scheduling.repository.AvailabilityRuleRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Availability rules and exceptions per veterinarian, and the resolved
 * bookable windows derived from them.
 *
 * <p>Resolved windows are cached per (vet, date), up to
 * {@code scheduling.availability-cache-max-entries} entries in LRU order.
 * Every change made through this service moves the vet to a new cache
 * generation once the change has committed and drops the vet's entries, so
 * windows computed from older data are never read again.
 */
@Service
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private static final int SECONDS_PER_DAY = 24 * 60 * 60;

    private final AvailabilityRuleRepository ruleRepository;
    private final AvailabilityExceptionRepository exceptionRepository;
    private final AvailabilityResolver resolver;
    private final SchedulingSettings settings;

    private final ConcurrentHashMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

    /** Access-ordered, bounded; guarded by its own monitor. */
    private final Map<CacheKey, List<TimeWindow>> cache;

    public AvailabilityService(AvailabilityRuleRepository ruleRepository,
                               AvailabilityExceptionRepository exceptionRepository,
                               AvailabilityResolver resolver,
                               SchedulingSettings settings) {
        this.ruleRepository = ruleRepository;
        this.exceptionRepository = exceptionRepository;
        this.resolver = resolver;
        this.settings = settings;

        int maxEntries = settings.getAvailabilityCacheMaxEntries();
        this.cache = new LinkedHashMap<>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, List<TimeWindow>> eldest) {
                return size() > maxEntries;
            }
        };
    }

    // =========================================================
    // RESOLVED WINDOWS
    // =========================================================
    @Transactional(readOnly = true)
    public List<TimeWindow> windowsFor(String vetId, LocalDate date) {
        if (!settings.isAvailabilityCacheEnabled()) {
            return resolveFromStorage(vetId, date);
        }
        long generation = currentGeneration(vetId);
        CacheKey key = new CacheKey(vetId, date, generation);
        List<TimeWindow> cached;
        synchronized (cache) {
            cached = cache.get(key);
        }
        if (cached != null) return cached;

        List<TimeWindow> resolved = resolveFromStorage(vetId, date);
        synchronized (cache) {
            // skipped when an invalidation ran while resolving
            if (currentGeneration(vetId) == generation) {
                cache.put(key, resolved);
            }
        }
        return resolved;
    }

    /**
     * Coalesced windows of every date in {@code [from, to]}; windows running
     * across midnight into an adjacent date are merged.
     */
    @Transactional(readOnly = true)
    public List<TimeWindow> windowsBetween(String vetId, LocalDate from, LocalDate to) {
        List<TimeWindow> all = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            all.addAll(windowsFor(vetId, d));
        }
        return Intervals.coalesce(all);
    }

    private List<TimeWindow> resolveFromStorage(String vetId, LocalDate date) {
        List<AvailabilityRule> rules = ruleRepository.findByVetIdAndDayOfWeekOrderByStartTimeAsc(vetId, date.getDayOfWeek());
        List<AvailabilityException> exceptions = exceptionRepository.findByVetIdAndExceptionDate(vetId, date);
        return List.copyOf(resolver.resolve(date, rules, exceptions));
    }

    // =========================================================
    // RULES
    // =========================================================
    @Transactional(readOnly = true)
    public List<AvailabilityRule> listRules(String vetId) {
        return ruleRepository.findByVetIdOrderByDayOfWeekAscStartTimeAsc(vetId);
    }

    @Transactional
    public AvailabilityRule addRule(AvailabilityRule rule) {
        requireVetId(rule.getVetId());
        validateTimes(rule.getStartTime(), rule.getEndTime());
        if (rule.getEffectiveFrom() == null) {
            throw new IllegalArgumentException("effectiveFrom is required");
        }
        if (rule.getEffectiveUntil() != null && rule.getEffectiveUntil().isBefore(rule.getEffectiveFrom())) {
            throw new IllegalArgumentException("effectiveUntil must not be before effectiveFrom");
        }
        for (AvailabilityRule other : ruleRepository.findByVetIdAndDayOfWeekOrderByStartTimeAsc(rule.getVetId(), rule.getDayOfWeek())) {
            if (rule.effectiveRangeIntersects(other)
                    && timesOverlap(rule.getStartTime(), rule.getEndTime(), other.getStartTime(), other.getEndTime())) {
                throw new IllegalArgumentException("Rule overlaps existing rule " + other.getId()
                        + " (" + other.getDayOfWeek() + " " + other.getStartTime() + "-" + other.getEndTime() + ")");
            }
        }
        AvailabilityRule saved = ruleRepository.save(rule);
        invalidateAfterCommit(rule.getVetId());
        log.info("Added availability rule: vet={} day={} {}-{}", rule.getVetId(), rule.getDayOfWeek(),
                rule.getStartTime(), rule.getEndTime());
        return saved;
    }

    @Transactional
    public void removeRule(String vetId, Long ruleId) {
        AvailabilityRule rule = ruleRepository.findByIdAndVetId(ruleId, vetId)
                .orElseThrow(() -> new SchedulingException(SchedulingError.NOT_FOUND, "Availability rule not found: " + ruleId));
        ruleRepository.delete(rule);
        invalidateAfterCommit(vetId);
        log.info("Removed availability rule {} for vet {}", ruleId, vetId);
    }

    // =========================================================
    // EXCEPTIONS
    // =========================================================
    @Transactional(readOnly = true)
    public List<AvailabilityException> listExceptions(String vetId, LocalDate from, LocalDate to) {
        return exceptionRepository.findByVetIdAndExceptionDateBetweenOrderByExceptionDateAscStartTimeAsc(vetId, from, to);
    }

    @Transactional
    public AvailabilityException addException(AvailabilityException exception) {
        requireVetId(exception.getVetId());
        validateTimes(exception.getStartTime(), exception.getEndTime());
        if (exception.getExceptionDate() == null || exception.getKind() == null) {
            throw new IllegalArgumentException("Exception date and kind are required");
        }
        AvailabilityException saved = exceptionRepository.save(exception);
        invalidateAfterCommit(exception.getVetId());
        log.info("Added availability exception: vet={} date={} kind={} {}-{}", exception.getVetId(),
                exception.getExceptionDate(), exception.getKind(), exception.getStartTime(), exception.getEndTime());
        return saved;
    }

    @Transactional
    public void removeException(String vetId, Long exceptionId) {
        AvailabilityException exception = exceptionRepository.findByIdAndVetId(exceptionId, vetId)
                .orElseThrow(() -> new SchedulingException(SchedulingError.NOT_FOUND, "Availability exception not found: " + exceptionId));
        exceptionRepository.delete(exception);
        invalidateAfterCommit(vetId);
        log.info("Removed availability exception {} for vet {}", exceptionId, vetId);
    }

    // =========================================================
    // CACHE
    // =========================================================
    public void invalidate(String vetId) {
        generations.computeIfAbsent(vetId, id -> new AtomicLong()).incrementAndGet();
        synchronized (cache) {
            cache.keySet().removeIf(k -> k.vetId().equals(vetId));
        }
        log.debug("Availability cache invalidated for vet {}", vetId);
    }

    private void invalidateAfterCommit(String vetId) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    invalidate(vetId);
                }
            });
        } else {
            invalidate(vetId);
        }
    }

    /** Vets that were never invalidated are at generation 0 and get no counter. */
    private long currentGeneration(String vetId) {
        AtomicLong generation = generations.get(vetId);
        return generation == null ? 0L : generation.get();
    }

    int cachedEntries() {
        synchronized (cache) {
            return cache.size();
        }
    }

    // =========================================================
    // VALIDATION
    // =========================================================
    private static void requireVetId(String vetId) {
        if (StringUtils.isBlank(vetId)) {
            throw new IllegalArgumentException("vetId is required");
        }
        if (vetId.length() > Appointment.MAX_ID_LENGTH) {
            throw new IllegalArgumentException("vetId must be at most " + Appointment.MAX_ID_LENGTH + " characters");
        }
    }

    private void validateTimes(LocalTime start, LocalTime end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Start and end times are required");
        }
        if (endSecond(end) <= start.toSecondOfDay()) {
            throw new IllegalArgumentException("Start time must be before end time");
        }
        long step = settings.getGranularity().getSeconds();
        if (start.toNanoOfDay() % settings.getGranularity().toNanos() != 0
                || end.toNanoOfDay() % settings.getGranularity().toNanos() != 0) {
            throw new IllegalArgumentException("Times must align to " + (step / 60) + "-minute increments");
        }
    }

    private static boolean timesOverlap(LocalTime s1, LocalTime e1, LocalTime s2, LocalTime e2) {
        return s1.toSecondOfDay() < endSecond(e2) && s2.toSecondOfDay() < endSecond(e1);
    }

    /** 00:00 as an end time stands for the end of the day. */
    private static int endSecond(LocalTime end) {
        return LocalTime.MIDNIGHT.equals(end) ? SECONDS_PER_DAY : end.toSecondOfDay();
    }

    private record CacheKey(String vetId, LocalDate date, long generation) {
    }
}
