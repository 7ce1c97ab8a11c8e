package com.vet.scheduling.repository;

import com.vet.scheduling.entity.AvailabilityException;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface AvailabilityExceptionRepository extends JpaRepository<AvailabilityException, Long> {

    List<AvailabilityException> findByVetIdAndExceptionDate(String vetId, LocalDate exceptionDate);

    List<AvailabilityException> findByVetIdAndExceptionDateBetweenOrderByExceptionDateAscStartTimeAsc(
            String vetId,
            LocalDate from,
            LocalDate to
    );

    Optional<AvailabilityException> findByIdAndVetId(Long id, String vetId);
}
