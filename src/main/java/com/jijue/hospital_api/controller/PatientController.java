package com.jijue.hospital_api.controller;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.jijue.hospital_api.dto.AppointmentRequest;
import com.jijue.hospital_api.dto.AuthResponse;
import com.jijue.hospital_api.dto.CancellationRequest;
import com.jijue.hospital_api.dto.LabWorkRequest;
import com.jijue.hospital_api.dto.PatientRegistrationRequest;
import com.jijue.hospital_api.dto.PatientUpdateRequest;
import com.jijue.hospital_api.dto.PortalLoginRequest;
import com.jijue.hospital_api.dto.PrescriptionRequest;
import com.jijue.hospital_api.dto.ProfileUpdateRequest;
import com.jijue.hospital_api.dto.RefillRequest;
import com.jijue.hospital_api.dto.RescheduleRequest;
import com.jijue.hospital_api.exception.GlobalExceptionHandler;
import com.jijue.hospital_api.model.Appointment;
import com.jijue.hospital_api.model.MedicalRecord;
import com.jijue.hospital_api.model.Patient;
import com.jijue.hospital_api.model.Role;
import com.jijue.hospital_api.model.User;
import com.jijue.hospital_api.security.AccessGuard;
import com.jijue.hospital_api.service.AppointmentService;
import com.jijue.hospital_api.service.LabRequestService;
import com.jijue.hospital_api.service.MedicalRecordService;
import com.jijue.hospital_api.service.PatientPortalService;
import com.jijue.hospital_api.service.PatientService;
import com.jijue.hospital_api.service.PrescriptionService;
import com.jijue.hospital_api.service.RecordsExportService;
import com.jijue.hospital_api.service.UserService;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/patients")
@RequiredArgsConstructor
public class PatientController {

    private static final Logger logger = LoggerFactory.getLogger(PatientController.class);

    private static final String PATIENT_SCOPE = "@accessGuard.canAccessPatient(authentication, #patientId)";

    private final PatientService patientService;
    private final UserService userService;
    private final AppointmentService appointmentService;
    private final PrescriptionService prescriptionService;
    private final LabRequestService labRequestService;
    private final MedicalRecordService medicalRecordService;
    private final PatientPortalService patientPortalService;
    private final RecordsExportService recordsExportService;
    private final AccessGuard accessGuard;

    // --- Administration ---

    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> getAllPatients() {
        List<Patient> patients = patientService.getAllPatients();
        return ResponseEntity.ok(Map.of("success", true, "count", patients.size(), "data", patients));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> createPatient(@RequestBody Patient patient) {
        Patient saved = patientService.createPatient(patient);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "data", saved));
    }

    @GetMapping("/{id}")
    @PreAuthorize("@accessGuard.canAccessProfile(authentication, #id)")
    public ResponseEntity<Map<String, Object>> getPatient(@PathVariable String id) {
        return ResponseEntity.ok(Map.of("success", true, "data", patientService.getPatientById(id)));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN') or @accessGuard.canAccessProfile(authentication, #id)")
    public ResponseEntity<Map<String, Object>> updatePatient(@PathVariable String id,
                                                             @RequestBody PatientUpdateRequest request,
                                                             Authentication authentication) {
        Patient updated = patientService.updatePatient(id, request, accessGuard.isAdmin(authentication));
        return ResponseEntity.ok(Map.of("success", true, "data", updated));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> deletePatient(@PathVariable String id) {
        patientService.deletePatient(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Patient deleted successfully"));
    }

    // --- Portal access ---

    @PostMapping("/register")
    public ResponseEntity<Map<String, Object>> register(@RequestBody PatientRegistrationRequest request) {
        logger.info("=== PATIENT INTAKE REGISTRATION === {}", request.email());
        Patient patient = patientService.register(request);
        User account = userService.ensurePatientAccount(patient);
        AuthResponse auth = userService.issueToken(account, "Registration successful");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Registration successful");
        body.put("token", auth.token());
        body.put("patient", summary(patient));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/login")
    public ResponseEntity<?> login(@RequestBody PortalLoginRequest request) {
        logger.info("=== PATIENT PORTAL LOGIN === {}", request.email());
        try {
            AuthResponse auth = userService.loginWithIdNumber(request);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("message", auth.message());
            body.put("token", auth.token());
            body.put("patient", summary(patientService.getByPatientId(auth.user().patientId())));
            return ResponseEntity.ok(body);
        } catch (BadCredentialsException e) {
            logger.warn("=== PORTAL LOGIN FAILED (Invalid Credentials) === {}", request.email());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(GlobalExceptionHandler.errorBody(e.getMessage()));
        } catch (DisabledException e) {
            logger.warn("=== PORTAL LOGIN FAILED (Inactive) === {}", request.email());
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(GlobalExceptionHandler.errorBody(e.getMessage()));
        }
    }

    @PostMapping("/forgot-id")
    public ResponseEntity<Map<String, Object>> forgotId(@RequestBody Map<String, String> body) {
        String message = patientService.forgotId(body.get("email"));
        return ResponseEntity.ok(Map.of("success", true, "message", message));
    }

    // --- Profile ---

    @GetMapping("/profile/{patientId}")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> getProfileByCode(@PathVariable String patientId) {
        return ResponseEntity.ok(Map.of("success", true, "data", patientService.getByPatientId(patientId)));
    }

    @GetMapping("/{patientId}/profile")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> getProfile(@PathVariable String patientId) {
        return ResponseEntity.ok(Map.of("success", true, "data", patientService.getByPatientId(patientId)));
    }

    @PutMapping("/{patientId}/profile")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> updateProfile(@PathVariable String patientId,
                                                             @RequestBody ProfileUpdateRequest request) {
        Patient updated = patientService.updateProfile(patientId, request);
        return ResponseEntity.ok(Map.of("success", true, "message", "Profile updated successfully", "data", updated));
    }

    // --- Dashboard ---

    @GetMapping("/{patientId}/overview")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> getOverview(@PathVariable String patientId) {
        return ResponseEntity.ok(Map.of("success", true, "data", patientPortalService.getOverview(patientId)));
    }

    @GetMapping("/{patientId}/medical-records")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> getMedicalRecords(@PathVariable String patientId) {
        return ResponseEntity.ok(Map.of("success", true, "data", medicalRecordService.getRecords(patientId)));
    }

    @PostMapping("/{patientId}/medical-records")
    @PreAuthorize("hasAnyRole('DOCTOR', 'ADMIN')")
    public ResponseEntity<Map<String, Object>> addMedicalRecord(@PathVariable String patientId,
                                                                @RequestBody MedicalRecord record,
                                                                Authentication authentication) {
        Patient patient = patientService.getByPatientId(patientId);
        User user = accessGuard.currentUser(authentication);
        String doctorId = user != null && user.hasRole(Role.ROLE_DOCTOR) ? user.getProfileId() : null;
        MedicalRecord saved = medicalRecordService.addRecord(patient, record, doctorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "data", saved));
    }

    @GetMapping("/{patientId}/lab-results")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> getLabResults(@PathVariable String patientId) {
        return ResponseEntity.ok(Map.of("success", true, "data", labRequestService.getLabRequests(patientId, null)));
    }

    @GetMapping("/{patientId}/prescriptions")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> getPrescriptions(@PathVariable String patientId) {
        return ResponseEntity.ok(Map.of("success", true, "data", prescriptionService.getPrescriptions(patientId, null)));
    }

    @GetMapping("/{patientId}/health-metrics")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> getHealthMetrics(@PathVariable String patientId) {
        return ResponseEntity.ok(Map.of("success", true, "data", patientPortalService.getHealthMetrics(patientId)));
    }

    // --- Appointments ---

    @GetMapping("/{patientId}/appointments")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> getAppointments(@PathVariable String patientId,
                                                               @RequestParam(required = false) String status,
                                                               @RequestParam(defaultValue = "0") int limit) {
        return ResponseEntity.ok(Map.of("success", true,
                "data", patientPortalService.getAppointments(patientId, status, limit)));
    }

    @PostMapping("/{patientId}/appointments/book")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> bookAppointment(@PathVariable String patientId,
                                                               @RequestBody AppointmentRequest request) {
        Appointment appointment = appointmentService.createAppointment(request.forPatient(patientId));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "success", true,
                "message", "Appointment booked successfully",
                "data", appointment));
    }

    @PutMapping("/appointments/{appointmentId}/reschedule")
    public ResponseEntity<Map<String, Object>> rescheduleAppointment(@PathVariable String appointmentId,
                                                                     @RequestBody RescheduleRequest request,
                                                                     Authentication authentication) {
        Appointment appointment = appointmentService.getAppointment(appointmentId);
        accessGuard.requirePatientAccess(authentication, appointment.getPatientId());
        Appointment moved = appointmentService.rescheduleAppointment(appointment.getId(), request);
        return ResponseEntity.ok(Map.of("success", true, "message", "Appointment rescheduled successfully", "data", moved));
    }

    @PutMapping("/appointments/{appointmentId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelAppointment(@PathVariable String appointmentId,
                                                                 @RequestBody(required = false) CancellationRequest request,
                                                                 Authentication authentication) {
        Appointment appointment = appointmentService.getAppointment(appointmentId);
        accessGuard.requirePatientAccess(authentication, appointment.getPatientId());
        String reason = request != null ? request.reason() : null;
        Appointment cancelled = appointmentService.cancelAppointment(appointment.getId(),
                new CancellationRequest(reason, "patient"), "patient");
        return ResponseEntity.ok(Map.of("success", true, "message", "Appointment cancelled successfully", "data", cancelled));
    }

    // --- Records ---

    @GetMapping("/{patientId}/records/download")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> downloadRecords(@PathVariable String patientId) {
        return ResponseEntity.ok(Map.of("success", true, "data", patientPortalService.getRecordsBundle(patientId)));
    }

    @GetMapping("/{patientId}/records/export")
    @PreAuthorize(PATIENT_SCOPE)
    public void exportRecords(@PathVariable String patientId, HttpServletResponse response) throws IOException {
        logger.info(">>> Received request to export records of patient {}", patientId);
        try {
            ByteArrayInputStream bis = recordsExportService.generateRecordsExcel(patientId);
            String filename = recordsExportService.getExcelFilename(patientId);

            response.setContentType("application/vnd.ms-excel");
            response.setHeader(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"");
            bis.transferTo(response.getOutputStream());
            response.flushBuffer();
            logger.info(">>> Exported records of patient {}", patientId);
        } catch (IOException e) {
            logger.error(">>> Error writing records workbook for patient {}:", patientId, e);
            response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Error generating Excel file.");
        }
    }

    // --- Requests ---

    @PostMapping("/{patientId}/lab-requests")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> requestLabWork(@PathVariable String patientId,
                                                              @RequestBody LabWorkRequest request) {
        Patient patient = patientService.getByPatientId(patientId);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "success", true,
                "message", "Lab test requested successfully",
                "data", labRequestService.createLabRequest(patient, request)));
    }

    @PostMapping("/{patientId}/prescriptions/request")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> requestPrescription(@PathVariable String patientId,
                                                                   @RequestBody PrescriptionRequest request) {
        Patient patient = patientService.getByPatientId(patientId);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "success", true,
                "message", "Prescription requested successfully",
                "data", prescriptionService.requestPrescription(patient, request)));
    }

    @PostMapping("/{patientId}/prescriptions/refill")
    @PreAuthorize(PATIENT_SCOPE)
    public ResponseEntity<Map<String, Object>> requestRefill(@PathVariable String patientId,
                                                             @RequestBody RefillRequest request) {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Refill requested successfully",
                "data", prescriptionService.requestRefill(patientId, request)));
    }

    private static Map<String, Object> summary(Patient patient) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", patient.getId());
        summary.put("patientId", patient.getPatientId());
        summary.put("firstName", patient.getFirstName());
        summary.put("lastName", patient.getLastName());
        summary.put("email", patient.getEmail());
        summary.put("phone", patient.getPhone());
        return summary;
    }
}
