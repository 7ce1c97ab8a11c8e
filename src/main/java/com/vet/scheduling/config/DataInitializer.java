package com.vet.scheduling.config;

import com.vet.scheduling.entity.AvailabilityRule;
import com.vet.scheduling.repository.AvailabilityRuleRepository;
import com.vet.scheduling.service.AvailabilityService;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.EnumSet;

/**
 * Idempotent demo seeder: gives each configured vet Monday-Friday working
 * hours (09:00-12:00 and 13:00-17:00) unless it already has rules.
 */
@Component
@ConditionalOnProperty(name = "scheduling.seed.enabled", havingValue = "true")
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private static final LocalTime MORNING_START = LocalTime.of(9, 0);
    private static final LocalTime MORNING_END = LocalTime.of(12, 0);
    private static final LocalTime AFTERNOON_START = LocalTime.of(13, 0);
    private static final LocalTime AFTERNOON_END = LocalTime.of(17, 0);

    private final AvailabilityRuleRepository ruleRepository;
    private final AvailabilityService availabilityService;
    private final Clock clock;
    private final String vetIds;

    public DataInitializer(AvailabilityRuleRepository ruleRepository,
                           AvailabilityService availabilityService,
                           Clock clock,
                           @Value("${scheduling.seed.vet-ids:}") String vetIds) {
        this.ruleRepository = ruleRepository;
        this.availabilityService = availabilityService;
        this.clock = clock;
        this.vetIds = vetIds;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seed() {
        LocalDate today = LocalDate.now(clock);
        int seeded = 0;
        for (String raw : StringUtils.split(vetIds, ',')) {
            String vetId = raw.trim();
            if (vetId.isEmpty() || ruleRepository.existsByVetId(vetId)) continue;

            for (DayOfWeek day : EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY)) {
                availabilityService.addRule(rule(vetId, day, MORNING_START, MORNING_END, today));
                availabilityService.addRule(rule(vetId, day, AFTERNOON_START, AFTERNOON_END, today));
            }
            seeded++;
            log.info("Added working hours for vet {}", vetId);
        }
        log.info("DataInitializer: seeded {} vets", seeded);
    }

    private static AvailabilityRule rule(String vetId, DayOfWeek day, LocalTime start, LocalTime end, LocalDate from) {
        return AvailabilityRule.builder()
                .vetId(vetId)
                .dayOfWeek(day)
                .startTime(start)
                .endTime(end)
                .effectiveFrom(from)
                .build();
    }
}
