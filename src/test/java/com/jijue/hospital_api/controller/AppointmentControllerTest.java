package com.jijue.hospital_api.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.jijue.hospital_api.dto.AppointmentRequest;
import com.jijue.hospital_api.exception.AppointmentConflictException;
import com.jijue.hospital_api.exception.GlobalExceptionHandler;
import com.jijue.hospital_api.model.Appointment;
import com.jijue.hospital_api.model.Role;
import com.jijue.hospital_api.model.User;
import com.jijue.hospital_api.security.AccessGuard;
import com.jijue.hospital_api.service.AppointmentService;

@ExtendWith(MockitoExtension.class)
class AppointmentControllerTest {

    private static final String BOOKING = """
            {"patientId":"PAT999999999","doctorId":"DOC12345678ABCD","appointmentDate":"2024-06-10",
             "appointmentTime":"10:00","reason":"Follow-up"}
            """;

    @Mock
    private AppointmentService appointmentService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AppointmentController(appointmentService, new AccessGuard()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void patientBooksOnlyForThemselves() throws Exception {
        User patient = new User("mary@jijue.test", "hashed", Role.ROLE_PATIENT);
        patient.setCode("PAT111111111");
        Appointment saved = new Appointment("d-1", LocalDate.of(2024, 6, 10), "10:00", 30);
        when(appointmentService.createAppointment(any(AppointmentRequest.class))).thenReturn(saved);

        mockMvc.perform(post("/api/appointments")
                        .principal(new UsernamePasswordAuthenticationToken(patient, null, patient.getAuthorities()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOKING))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Appointment booked successfully"));

        ArgumentCaptor<AppointmentRequest> captor = ArgumentCaptor.forClass(AppointmentRequest.class);
        verify(appointmentService).createAppointment(captor.capture());
        assertThat(captor.getValue().patientId()).isEqualTo("PAT111111111");
    }

    @Test
    void overlappingBookingAnswersConflictWithDetails() throws Exception {
        Appointment existing = new Appointment("d-1", LocalDate.of(2024, 6, 10), "10:00", 30);
        existing.setId("a-1");
        existing.setAppointmentId("APT123456001");
        when(appointmentService.createAppointment(any(AppointmentRequest.class)))
                .thenThrow(new AppointmentConflictException(AppointmentService.CONFLICT_MESSAGE, List.of(existing)));

        mockMvc.perform(post("/api/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOKING))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Doctor already has an appointment at this time"))
                .andExpect(jsonPath("$.conflicts[0].appointmentId").value("APT123456001"))
                .andExpect(jsonPath("$.conflicts[0].appointmentTime").value("10:00"));
    }

    @Test
    void missingFieldsAreBadRequest() throws Exception {
        when(appointmentService.createAppointment(any(AppointmentRequest.class)))
                .thenThrow(new IllegalArgumentException("Missing required fields: reason"));

        mockMvc.perform(post("/api/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patientId\":\"PAT999999999\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Missing required fields: reason"));
    }
}
