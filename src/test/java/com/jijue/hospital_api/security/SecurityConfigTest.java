package com.jijue.hospital_api.security;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.test.web.servlet.MockMvc;

import com.jijue.hospital_api.controller.AppointmentController;
import com.jijue.hospital_api.controller.PatientController;
import com.jijue.hospital_api.dto.AppointmentStats;
import com.jijue.hospital_api.model.Role;
import com.jijue.hospital_api.model.User;
import com.jijue.hospital_api.repository.UserRepository;
import com.jijue.hospital_api.service.AppointmentService;
import com.jijue.hospital_api.service.LabRequestService;
import com.jijue.hospital_api.service.MedicalRecordService;
import com.jijue.hospital_api.service.PatientPortalService;
import com.jijue.hospital_api.service.PatientService;
import com.jijue.hospital_api.service.PrescriptionService;
import com.jijue.hospital_api.service.RecordsExportService;
import com.jijue.hospital_api.service.UserService;

import io.jsonwebtoken.ExpiredJwtException;

/**
 * Runs requests through the real filter chain, method security and error handler.
 */
@WebMvcTest(controllers = { PatientController.class, AppointmentController.class })
@Import({ SecurityConfig.class, AccessGuard.class })
class SecurityConfigTest {

    private static final String FORBIDDEN = "You do not have permission to perform this action.";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JwtService jwtService;
    @MockBean
    private UserRepository userRepository;
    @MockBean
    private PatientService patientService;
    @MockBean
    private UserService userService;
    @MockBean
    private AppointmentService appointmentService;
    @MockBean
    private PrescriptionService prescriptionService;
    @MockBean
    private LabRequestService labRequestService;
    @MockBean
    private MedicalRecordService medicalRecordService;
    @MockBean
    private PatientPortalService patientPortalService;
    @MockBean
    private RecordsExportService recordsExportService;

    private static Authentication as(Role role, String code) {
        User user = new User(role.label() + "@jijue.test", "hashed", role);
        user.setCode(code);
        return new UsernamePasswordAuthenticationToken(user, null, user.getAuthorities());
    }

    @Test
    void protectedRouteWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/patients/PAT111111111/overview"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Access denied. No token provided."));

        verifyNoInteractions(patientPortalService);
    }

    @Test
    void expiredTokenIsReportedAsSuch() throws Exception {
        when(jwtService.extractUsername("stale")).thenThrow(new ExpiredJwtException(null, null, "expired"));

        mockMvc.perform(get("/api/appointments/stats/overview").header("Authorization", "Bearer stale"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Token has expired. Please login again."));
    }

    @Test
    void patientCannotReadAnotherPatientsDashboard() throws Exception {
        mockMvc.perform(get("/api/patients/PAT222222222/overview")
                        .with(authentication(as(Role.ROLE_PATIENT, "PAT111111111"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value(FORBIDDEN));

        verifyNoInteractions(patientPortalService);
    }

    @Test
    void appointmentStatsAreForAdminsOnly() throws Exception {
        mockMvc.perform(get("/api/appointments/stats/overview")
                        .with(authentication(as(Role.ROLE_PATIENT, "PAT111111111"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value(FORBIDDEN));

        when(appointmentService.getStats()).thenReturn(new AppointmentStats(4, 1, 2, Map.of("scheduled", 2L)));

        mockMvc.perform(get("/api/appointments/stats/overview")
                        .with(authentication(as(Role.ROLE_ADMIN, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.upcoming").value(2));
    }

    @Test
    void unknownApiRouteIsNotFoundEvenWithoutToken() throws Exception {
        mockMvc.perform(get("/api/no-such-endpoint"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("API endpoint not found"));
    }

    @Test
    void knownPathWithoutTokenStillNeedsAuthentication() throws Exception {
        mockMvc.perform(delete("/api/appointments/APT1"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(appointmentService);
    }
}
