package com.vet.scheduling.repository;

import com.vet.scheduling.entity.Appointment;
import com.vet.scheduling.entity.AppointmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);

    /**
     * Appointments of the vet in the given status whose half-open interval
     * intersects {@code [start, end)}.
     */
    @Query("SELECT a FROM Appointment a WHERE a.vetId = :vetId AND a.status = :status "
            + "AND a.startsAt < :end AND a.endsAt > :start ORDER BY a.startsAt ASC")
    List<Appointment> findOverlapping(@Param("vetId") String vetId,
                                      @Param("status") AppointmentStatus status,
                                      @Param("start") Instant start,
                                      @Param("end") Instant end);

    List<Appointment> findByVetIdAndStartsAtLessThanAndEndsAtGreaterThanOrderByStartsAtAsc(
            String vetId,
            Instant end,
            Instant start
    );

    List<Appointment> findByVetIdAndStatusAndStartsAtLessThanAndEndsAtGreaterThanOrderByStartsAtAsc(
            String vetId,
            AppointmentStatus status,
            Instant end,
            Instant start
    );
}
