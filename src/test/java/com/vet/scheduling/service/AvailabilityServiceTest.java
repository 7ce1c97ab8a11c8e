package com.vet.scheduling.service;

import com.vet.scheduling.calendar.AvailabilityResolver;
import com.vet.scheduling.calendar.TimeWindow;
import com.vet.scheduling.config.SchedulingSettings;
import com.vet.scheduling.entity.AvailabilityRule;
import com.vet.scheduling.repository.AvailabilityExceptionRepository;
import com.vet.scheduling.repository.AvailabilityRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class AvailabilityServiceTest {

    private static final String VET = "house";
    private static final LocalDate MONDAY = LocalDate.of(2031, 3, 3);
    private static final AvailabilityRule MONDAY_HOURS = AvailabilityRule.builder()
            .id(1L)
            .vetId(VET)
            .dayOfWeek(DayOfWeek.MONDAY)
            .startTime(LocalTime.of(9, 0))
            .endTime(LocalTime.of(17, 0))
            .effectiveFrom(LocalDate.of(2031, 1, 1))
            .build();

    private AvailabilityRuleRepository ruleRepository;
    private AvailabilityExceptionRepository exceptionRepository;
    private AvailabilityService service;

    @BeforeEach
    public void setUp() {
        ruleRepository = mock(AvailabilityRuleRepository.class);
        exceptionRepository = mock(AvailabilityExceptionRepository.class);
        SchedulingSettings settings = SchedulingSettings.defaults().toBuilder()
                .availabilityCacheMaxEntries(3)
                .build();
        service = new AvailabilityService(ruleRepository, exceptionRepository, new AvailabilityResolver(settings), settings);

        when(ruleRepository.findByVetIdAndDayOfWeekOrderByStartTimeAsc(VET, DayOfWeek.MONDAY))
                .thenReturn(List.of(MONDAY_HOURS));
    }

    @Test
    public void repeatedLookupsAreServedFromCache() {
        List<TimeWindow> first = service.windowsFor(VET, MONDAY);
        List<TimeWindow> second = service.windowsFor(VET, MONDAY);

        assertEquals(List.of(new TimeWindow(Instant.parse("2031-03-03T09:00:00Z"), Instant.parse("2031-03-03T17:00:00Z"))),
                first);
        assertEquals(first, second);
        verify(ruleRepository, times(1)).findByVetIdAndDayOfWeekOrderByStartTimeAsc(VET, DayOfWeek.MONDAY);
    }

    @Test
    public void cacheNeverGrowsPastItsLimit() {
        for (int i = 0; i < 40; i++) {
            service.windowsFor(VET, MONDAY.plusDays(i));
            service.windowsFor("vet-" + i, MONDAY);
        }

        assertEquals(3, service.cachedEntries());
    }

    @Test
    public void leastRecentlyUsedEntryIsEvictedFirst() {
        service.windowsFor(VET, MONDAY);
        service.windowsFor(VET, MONDAY.plusDays(1));
        service.windowsFor(VET, MONDAY.plusDays(2));
        service.windowsFor(VET, MONDAY);
        service.windowsFor(VET, MONDAY.plusDays(3));

        service.windowsFor(VET, MONDAY);

        verify(ruleRepository, times(1)).findByVetIdAndDayOfWeekOrderByStartTimeAsc(VET, DayOfWeek.MONDAY);
        verify(ruleRepository, times(1)).findByVetIdAndDayOfWeekOrderByStartTimeAsc(VET, DayOfWeek.TUESDAY);
    }

    @Test
    public void invalidationDropsTheVetsEntries() {
        service.windowsFor(VET, MONDAY);
        service.windowsFor("other", MONDAY);

        service.invalidate(VET);

        assertEquals(1, service.cachedEntries());
        service.windowsFor(VET, MONDAY);
        verify(ruleRepository, times(2)).findByVetIdAndDayOfWeekOrderByStartTimeAsc(VET, DayOfWeek.MONDAY);
    }

    @Test
    public void resultResolvedAcrossAnInvalidationIsNotCached() {
        when(ruleRepository.findByVetIdAndDayOfWeekOrderByStartTimeAsc(VET, DayOfWeek.MONDAY)).thenAnswer(inv -> {
            service.invalidate(VET);
            return List.of(MONDAY_HOURS);
        });

        assertEquals(1, service.windowsFor(VET, MONDAY).size());

        assertEquals(0, service.cachedEntries());
    }

    @Test
    public void overlongVetIdIsRejectedBeforeStorage() {
        AvailabilityRule rule = AvailabilityRule.builder()
                .vetId("v".repeat(65))
                .dayOfWeek(DayOfWeek.MONDAY)
                .startTime(LocalTime.of(9, 0))
                .endTime(LocalTime.of(17, 0))
                .effectiveFrom(LocalDate.of(2031, 1, 1))
                .build();

        assertThrows(IllegalArgumentException.class, () -> service.addRule(rule));
        verify(ruleRepository, never()).save(any());
    }

    @Test
    public void disabledCacheAlwaysResolves() {
        SchedulingSettings settings = SchedulingSettings.defaults().toBuilder().availabilityCacheEnabled(false).build();
        var uncached = new AvailabilityService(ruleRepository, exceptionRepository, new AvailabilityResolver(settings), settings);

        uncached.windowsFor(VET, MONDAY);
        uncached.windowsFor(VET, MONDAY);

        assertEquals(0, uncached.cachedEntries());
        verify(exceptionRepository, times(2)).findByVetIdAndExceptionDate(eq(VET), eq(MONDAY));
    }
}
