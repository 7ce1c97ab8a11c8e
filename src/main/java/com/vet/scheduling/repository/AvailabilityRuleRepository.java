package com.vet.scheduling.repository;

import com.vet.scheduling.entity.AvailabilityRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Optional;

@Repository
public interface AvailabilityRuleRepository extends JpaRepository<AvailabilityRule, Long> {

    List<AvailabilityRule> findByVetIdOrderByDayOfWeekAscStartTimeAsc(String vetId);

    List<AvailabilityRule> findByVetIdAndDayOfWeekOrderByStartTimeAsc(String vetId, DayOfWeek dayOfWeek);

    Optional<AvailabilityRule> findByIdAndVetId(Long id, String vetId);

    boolean existsByVetId(String vetId);
}
