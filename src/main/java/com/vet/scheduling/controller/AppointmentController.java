package com.vet.scheduling.controller;

import com.vet.scheduling.dto.AppointmentResponse;
import com.vet.scheduling.dto.CreateAppointmentRequest;
import com.vet.scheduling.dto.RescheduleAppointmentRequest;
import com.vet.scheduling.dto.StatusChangeRequest;
import com.vet.scheduling.dto.TimeSlotResponse;
import com.vet.scheduling.entity.Appointment;
import com.vet.scheduling.entity.AppointmentStatus;
import com.vet.scheduling.calendar.TimeWindow;
import com.vet.scheduling.service.SchedulingFacade;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api")
public class AppointmentController {

    private static final Logger log = LoggerFactory.getLogger(AppointmentController.class);

    private final SchedulingFacade schedulingFacade;

    public AppointmentController(SchedulingFacade schedulingFacade) {
        this.schedulingFacade = schedulingFacade;
    }

    @PostMapping("/vets/{vetId}/appointments")
    public ResponseEntity<AppointmentResponse> create(@PathVariable String vetId,
                                                      @Valid @RequestBody CreateAppointmentRequest request) {
        log.info("Create appointment: vet={} {}", vetId, request);
        Appointment appointment = schedulingFacade.createAppointment(vetId, request.getPetId(), request.getStart(), request.getEnd());
        return ResponseEntity.status(HttpStatus.CREATED).body(AppointmentResponse.from(appointment));
    }

    @GetMapping("/vets/{vetId}/appointments")
    public List<AppointmentResponse> list(@PathVariable String vetId,
                                          @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                          @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
                                          @RequestParam(required = false) AppointmentStatus status) {
        return schedulingFacade.listAppointments(vetId, from, to, status).stream()
                .map(AppointmentResponse::from)
                .toList();
    }

    @GetMapping("/vets/{vetId}/available-slots")
    public List<TimeSlotResponse> availableSlots(@PathVariable String vetId,
                                                 @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                                 @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
                                                 @RequestParam(required = false) Integer slotMinutes) {
        List<TimeWindow> windows = slotMinutes == null
                ? schedulingFacade.listAvailableSlots(vetId, from, to)
                : schedulingFacade.listAvailableSlots(vetId, from, to, Duration.ofMinutes(slotMinutes));
        return windows.stream().map(TimeSlotResponse::from).toList();
    }

    @GetMapping("/appointments/{id}")
    public AppointmentResponse get(@PathVariable Long id) {
        return AppointmentResponse.from(schedulingFacade.getAppointment(id));
    }

    @PutMapping("/appointments/{id}/schedule")
    public AppointmentResponse reschedule(@PathVariable Long id,
                                          @Valid @RequestBody RescheduleAppointmentRequest request) {
        log.info("Reschedule appointment {}: {}", id, request);
        return AppointmentResponse.from(schedulingFacade.rescheduleAppointment(
                id, request.getStart(), request.getEnd(), request.getExpectedVersion()));
    }

    @PostMapping("/appointments/{id}/cancel")
    public AppointmentResponse cancel(@PathVariable Long id,
                                      @Valid @RequestBody(required = false) StatusChangeRequest request) {
        StatusChangeRequest body = request != null ? request : new StatusChangeRequest();
        return AppointmentResponse.from(schedulingFacade.cancelAppointment(id, body.getExpectedVersion(), body.getReason()));
    }

    @PostMapping("/appointments/{id}/complete")
    public AppointmentResponse complete(@PathVariable Long id,
                                        @Valid @RequestBody(required = false) StatusChangeRequest request) {
        Long expectedVersion = request != null ? request.getExpectedVersion() : null;
        return AppointmentResponse.from(schedulingFacade.completeAppointment(id, expectedVersion));
    }

    @PostMapping("/appointments/{id}/no-show")
    public AppointmentResponse noShow(@PathVariable Long id,
                                      @Valid @RequestBody(required = false) StatusChangeRequest request) {
        Long expectedVersion = request != null ? request.getExpectedVersion() : null;
        return AppointmentResponse.from(schedulingFacade.markNoShow(id, expectedVersion));
    }
}
