package com.vet.scheduling.controller;

import com.vet.scheduling.calendar.SchedulingError;
import com.vet.scheduling.calendar.SchedulingException;
import com.vet.scheduling.calendar.TimeWindow;
import com.vet.scheduling.entity.Appointment;
import com.vet.scheduling.entity.AppointmentStatus;
import com.vet.scheduling.service.SchedulingFacade;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AppointmentController.class)
public class AppointmentControllerTest {

    private static final Instant START = Instant.parse("2031-03-03T10:00:00Z");
    private static final Instant END = Instant.parse("2031-03-03T10:30:00Z");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private SchedulingFacade facade;

    private static Appointment appointment(AppointmentStatus status, long version) {
        return Appointment.builder()
                .id(7L)
                .vetId("vet-1")
                .petId("pet-1")
                .startsAt(START)
                .endsAt(END)
                .status(status)
                .version(version)
                .createdAt(Instant.parse("2031-03-01T00:00:00Z"))
                .lastModifiedAt(Instant.parse("2031-03-01T00:00:00Z"))
                .build();
    }

    @Test
    public void createReturnsCreatedAppointment() throws Exception {
        when(facade.createAppointment("vet-1", "pet-1", START, END)).thenReturn(appointment(AppointmentStatus.SCHEDULED, 0));

        mvc.perform(post("/api/vets/vet-1/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"petId\":\"pet-1\",\"start\":\"2031-03-03T10:00:00Z\",\"end\":\"2031-03-03T10:30:00Z\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.status").value("SCHEDULED"))
                .andExpect(jsonPath("$.version").value(0))
                .andExpect(jsonPath("$.start").value("2031-03-03T10:00:00Z"));
    }

    @Test
    public void createWithMissingFieldsIsBadRequest() throws Exception {
        mvc.perform(post("/api/vets/vet-1/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\":\"2031-03-03T10:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    @Test
    public void overlongPetIdIsBadRequest() throws Exception {
        mvc.perform(post("/api/vets/vet-1/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"petId\":\"" + "p".repeat(65)
                                + "\",\"start\":\"2031-03-03T10:00:00Z\",\"end\":\"2031-03-03T10:30:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
        verifyNoInteractions(facade);
    }

    @Test
    public void takenSlotIsConflict() throws Exception {
        when(facade.createAppointment(any(), any(), any(), any()))
                .thenThrow(new SchedulingException(SchedulingError.SLOT_UNAVAILABLE, "Requested time overlaps appointment 3"));

        mvc.perform(post("/api/vets/vet-1/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"petId\":\"pet-1\",\"start\":\"2031-03-03T10:00:00Z\",\"end\":\"2031-03-03T10:30:00Z\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("SLOT_UNAVAILABLE"));
    }

    @Test
    public void outsideAvailabilityIsUnprocessable() throws Exception {
        when(facade.createAppointment(any(), any(), any(), any()))
                .thenThrow(new SchedulingException(SchedulingError.OUTSIDE_AVAILABILITY, "outside"));

        mvc.perform(post("/api/vets/vet-1/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"petId\":\"pet-1\",\"start\":\"2031-03-03T16:45:00Z\",\"end\":\"2031-03-03T17:15:00Z\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("OUTSIDE_AVAILABILITY"));
    }

    @Test
    public void busyCalendarAsksClientToRetry() throws Exception {
        when(facade.createAppointment(any(), any(), any(), any()))
                .thenThrow(new SchedulingException(SchedulingError.BUSY, "Calendar is busy, try again later"));

        mvc.perform(post("/api/vets/vet-1/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"petId\":\"pet-1\",\"start\":\"2031-03-03T10:00:00Z\",\"end\":\"2031-03-03T10:30:00Z\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "1"))
                .andExpect(jsonPath("$.error").value("BUSY"));
    }

    @Test
    public void rescheduleRequiresExpectedVersion() throws Exception {
        mvc.perform(put("/api/appointments/7/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\":\"2031-03-03T11:00:00Z\",\"end\":\"2031-03-03T11:30:00Z\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void staleRescheduleIsConflict() throws Exception {
        when(facade.rescheduleAppointment(eq(7L), any(), any(), eq(2L)))
                .thenThrow(new SchedulingException(SchedulingError.CONCURRENT_MODIFICATION, "stale"));

        mvc.perform(put("/api/appointments/7/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\":\"2031-03-03T11:00:00Z\",\"end\":\"2031-03-03T11:30:00Z\",\"expectedVersion\":2}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("CONCURRENT_MODIFICATION"));
    }

    @Test
    public void cancelWithoutBodySkipsVersionCheck() throws Exception {
        when(facade.cancelAppointment(eq(7L), isNull(), isNull())).thenReturn(appointment(AppointmentStatus.CANCELLED, 1));

        mvc.perform(post("/api/appointments/7/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
        verify(facade).cancelAppointment(7L, null, null);
    }

    @Test
    public void cancelPassesVersionAndReason() throws Exception {
        when(facade.cancelAppointment(7L, 0L, "owner called")).thenReturn(appointment(AppointmentStatus.CANCELLED, 1));

        mvc.perform(post("/api/appointments/7/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"expectedVersion\":0,\"reason\":\"owner called\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(1));
    }

    @Test
    public void completingUpcomingVisitIsConflict() throws Exception {
        when(facade.completeAppointment(7L, null))
                .thenThrow(new SchedulingException(SchedulingError.INVALID_TRANSITION, "not started"));

        mvc.perform(post("/api/appointments/7/complete"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_TRANSITION"));
    }

    @Test
    public void unknownAppointmentIsNotFound() throws Exception {
        when(facade.getAppointment(99L)).thenThrow(SchedulingException.notFound(99L));

        mvc.perform(get("/api/appointments/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    public void availableSlotsListsFreeWindows() throws Exception {
        LocalDate monday = LocalDate.of(2031, 3, 3);
        when(facade.listAvailableSlots("vet-1", monday, monday)).thenReturn(List.of(
                new TimeWindow(Instant.parse("2031-03-03T09:00:00Z"), START),
                new TimeWindow(END, Instant.parse("2031-03-03T17:00:00Z"))));

        mvc.perform(get("/api/vets/vet-1/available-slots").param("from", "2031-03-03").param("to", "2031-03-03"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].start").value("2031-03-03T09:00:00Z"))
                .andExpect(jsonPath("$[1].start").value("2031-03-03T10:30:00Z"));
    }

    @Test
    public void availableSlotsCanBeCutIntoFixedLengths() throws Exception {
        LocalDate monday = LocalDate.of(2031, 3, 3);
        when(facade.listAvailableSlots("vet-1", monday, monday, Duration.ofMinutes(30)))
                .thenReturn(List.of(new TimeWindow(START, END)));

        mvc.perform(get("/api/vets/vet-1/available-slots")
                        .param("from", "2031-03-03")
                        .param("to", "2031-03-03")
                        .param("slotMinutes", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].end").value("2031-03-03T10:30:00Z"));
    }

    @Test
    public void invalidRangeIsBadRequest() throws Exception {
        when(facade.listAvailableSlots(any(), any(), any()))
                .thenThrow(new IllegalArgumentException("'to' must not be before 'from'"));

        mvc.perform(get("/api/vets/vet-1/available-slots").param("from", "2031-03-10").param("to", "2031-03-03"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/vets/vet-1/available-slots").param("from", "not-a-date").param("to", "2031-03-03"))
                .andExpect(status().isBadRequest());
    }
}
