package com.vet.scheduling.config;

import lombok.Builder;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Scheduling policy knobs, bound from the {@code scheduling.*} properties.
 */
@Component
@Getter
public class SchedulingSettings {

    /** Clinic time zone; rule and exception times of day are local to it. */
    private final ZoneId zoneId;

    /** Appointment boundaries and durations must be multiples of this. */
    private final Duration granularity;

    private final Duration minDuration;

    private final Duration bookingLeadTime;

    private final boolean enforceLeadTime;

    private final boolean rescheduleEnforcesLeadTime;

    private final int maxAttempts;

    /** Upper bound on waiting for a veterinarian's timeline lock. */
    private final Duration lockTimeout;

    private final int maxListingDays;

    private final boolean availabilityCacheEnabled;

    /** Resolved (vet, date) entries kept before the least recently used is evicted. */
    private final int availabilityCacheMaxEntries;

    @Autowired
    public SchedulingSettings(@Value("${scheduling.zone-id:UTC}") String zoneId,
                              @Value("${scheduling.granularity:5m}") Duration granularity,
                              @Value("${scheduling.min-duration:5m}") Duration minDuration,
                              @Value("${scheduling.booking-lead-time:0s}") Duration bookingLeadTime,
                              @Value("${scheduling.enforce-lead-time:true}") boolean enforceLeadTime,
                              @Value("${scheduling.reschedule-enforces-lead-time:true}") boolean rescheduleEnforcesLeadTime,
                              @Value("${scheduling.max-attempts:3}") int maxAttempts,
                              @Value("${scheduling.lock-timeout:3s}") Duration lockTimeout,
                              @Value("${scheduling.max-listing-days:31}") int maxListingDays,
                              @Value("${scheduling.availability-cache-enabled:true}") boolean availabilityCacheEnabled,
                              @Value("${scheduling.availability-cache-max-entries:4096}") int availabilityCacheMaxEntries) {
        this(ZoneId.of(zoneId), granularity, minDuration, bookingLeadTime, enforceLeadTime,
                rescheduleEnforcesLeadTime, maxAttempts, lockTimeout, maxListingDays, availabilityCacheEnabled,
                availabilityCacheMaxEntries);
    }

    @Builder(toBuilder = true)
    private SchedulingSettings(ZoneId zoneId,
                               Duration granularity,
                               Duration minDuration,
                               Duration bookingLeadTime,
                               boolean enforceLeadTime,
                               boolean rescheduleEnforcesLeadTime,
                               int maxAttempts,
                               Duration lockTimeout,
                               int maxListingDays,
                               boolean availabilityCacheEnabled,
                               int availabilityCacheMaxEntries) {
        if (granularity.isZero() || granularity.isNegative()) {
            throw new IllegalArgumentException("scheduling.granularity must be positive");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("scheduling.max-attempts must be at least 1");
        }
        if (availabilityCacheMaxEntries < 1) {
            throw new IllegalArgumentException("scheduling.availability-cache-max-entries must be at least 1");
        }
        this.zoneId = zoneId;
        this.granularity = granularity;
        this.minDuration = minDuration;
        this.bookingLeadTime = bookingLeadTime;
        this.enforceLeadTime = enforceLeadTime;
        this.rescheduleEnforcesLeadTime = rescheduleEnforcesLeadTime;
        this.maxAttempts = maxAttempts;
        this.lockTimeout = lockTimeout;
        this.maxListingDays = maxListingDays;
        this.availabilityCacheEnabled = availabilityCacheEnabled;
        this.availabilityCacheMaxEntries = availabilityCacheMaxEntries;
    }

    public static SchedulingSettings defaults() {
        return builder()
                .zoneId(ZoneId.of("UTC"))
                .granularity(Duration.ofMinutes(5))
                .minDuration(Duration.ofMinutes(5))
                .bookingLeadTime(Duration.ZERO)
                .enforceLeadTime(true)
                .rescheduleEnforcesLeadTime(true)
                .maxAttempts(3)
                .lockTimeout(Duration.ofSeconds(3))
                .maxListingDays(31)
                .availabilityCacheEnabled(true)
                .availabilityCacheMaxEntries(4096)
                .build();
    }
}
