package com.jijue.hospital_api.controller;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.jijue.hospital_api.dto.AppointmentRequest;
import com.jijue.hospital_api.dto.AppointmentSearchCriteria;
import com.jijue.hospital_api.dto.AppointmentUpdateRequest;
import com.jijue.hospital_api.dto.CancellationRequest;
import com.jijue.hospital_api.dto.PageResult;
import com.jijue.hospital_api.dto.StatusUpdateRequest;
import com.jijue.hospital_api.model.Appointment;
import com.jijue.hospital_api.model.PrescriptionItem;
import com.jijue.hospital_api.model.VitalSigns;
import com.jijue.hospital_api.security.AccessGuard;
import com.jijue.hospital_api.service.AppointmentService;

import lombok.RequiredArgsConstructor;

/**
 * Appointment book. Patients only ever see and touch their own appointments;
 * doctors and admins see everything.
 */
@RestController
@RequestMapping("/api/appointments")
@RequiredArgsConstructor
public class AppointmentController {

    private static final Logger logger = LoggerFactory.getLogger(AppointmentController.class);

    private final AppointmentService appointmentService;
    private final AccessGuard accessGuard;

    @GetMapping
    public ResponseEntity<Map<String, Object>> getAppointments(
            @RequestParam(required = false) String patientId,
            @RequestParam(required = false) String doctorId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String type,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "appointmentDate") String sortBy,
            @RequestParam(defaultValue = "asc") String sortOrder,
            Authentication authentication) {
        AppointmentSearchCriteria criteria = new AppointmentSearchCriteria(
                patientId, doctorId, status, date, type, page, limit, sortBy, sortOrder);
        String ownCode = accessGuard.patientScope(authentication);
        if (ownCode != null) {
            criteria = criteria.forPatient(ownCode);
        }
        PageResult<Appointment> result = appointmentService.searchAppointments(criteria);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("appointments", result.items());
        body.put("pagination", result.pagination().describe("totalAppointments"));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stats/overview")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(Map.of("success", true, "data", appointmentService.getStats()));
    }

    @GetMapping("/patient/{patientId}")
    @PreAuthorize("@accessGuard.canAccessPatient(authentication, #patientId)")
    public ResponseEntity<Map<String, Object>> getPatientAppointments(@PathVariable String patientId,
                                                                      @RequestParam(required = false) String status,
                                                                      @RequestParam(defaultValue = "true") String upcoming) {
        List<Appointment> appointments = appointmentService.getPatientAppointments(patientId, status, upcoming);
        return ResponseEntity.ok(Map.of("success", true, "count", appointments.size(), "data", appointments));
    }

    @GetMapping("/doctor/{doctorId}")
    @PreAuthorize("hasAnyRole('DOCTOR', 'ADMIN')")
    public ResponseEntity<Map<String, Object>> getDoctorAppointments(
            @PathVariable String doctorId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String status) {
        List<Appointment> appointments = appointmentService.getDoctorAppointments(doctorId, date, status);
        return ResponseEntity.ok(Map.of("success", true, "count", appointments.size(), "data", appointments));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getAppointment(@PathVariable String id, Authentication authentication) {
        Appointment appointment = appointmentService.getAppointment(id);
        accessGuard.requirePatientAccess(authentication, appointment.getPatientId());
        return ResponseEntity.ok(Map.of("success", true, "data", appointment));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> createAppointment(@RequestBody AppointmentRequest request,
                                                                 Authentication authentication) {
        String ownCode = accessGuard.patientScope(authentication);
        AppointmentRequest booking = ownCode != null ? request.forPatient(ownCode) : request;
        logger.info("Booking request for patient {} with doctor {}", booking.patientId(), booking.doctorId());
        Appointment saved = appointmentService.createAppointment(booking);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "success", true,
                "message", "Appointment booked successfully",
                "data", saved));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Map<String, Object>> updateAppointment(@PathVariable String id,
                                                                 @RequestBody AppointmentUpdateRequest request,
                                                                 Authentication authentication) {
        Appointment existing = appointmentService.getAppointment(id);
        accessGuard.requirePatientAccess(authentication, existing.getPatientId());
        Appointment updated = appointmentService.updateAppointment(existing.getId(), request);
        return ResponseEntity.ok(Map.of("success", true, "message", "Appointment updated successfully", "data", updated));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> deleteAppointment(@PathVariable String id) {
        appointmentService.deleteAppointment(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Appointment deleted successfully"));
    }

    @PatchMapping("/{id}/status")
    @PreAuthorize("hasAnyRole('DOCTOR', 'ADMIN')")
    public ResponseEntity<Map<String, Object>> updateStatus(@PathVariable String id,
                                                            @RequestBody StatusUpdateRequest request) {
        Appointment updated = appointmentService.updateStatus(id, request);
        return ResponseEntity.ok(Map.of("success", true, "message", "Appointment status updated", "data", updated));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancelAppointment(@PathVariable String id,
                                                                 @RequestBody(required = false) CancellationRequest request,
                                                                 Authentication authentication) {
        Appointment existing = appointmentService.getAppointment(id);
        accessGuard.requirePatientAccess(authentication, existing.getPatientId());
        String defaultCancelledBy = accessGuard.patientScope(authentication) != null ? "patient" : "staff";
        Appointment cancelled = appointmentService.cancelAppointment(existing.getId(), request, defaultCancelledBy);
        return ResponseEntity.ok(Map.of("success", true, "message", "Appointment cancelled successfully", "data", cancelled));
    }

    @PutMapping("/{id}/vitals")
    @PreAuthorize("hasAnyRole('DOCTOR', 'ADMIN')")
    public ResponseEntity<Map<String, Object>> recordVitals(@PathVariable String id, @RequestBody VitalSigns vitals) {
        Appointment updated = appointmentService.recordVitals(id, vitals);
        return ResponseEntity.ok(Map.of("success", true, "message", "Vital signs recorded", "data", updated));
    }

    @PostMapping("/{id}/prescriptions")
    @PreAuthorize("hasAnyRole('DOCTOR', 'ADMIN')")
    public ResponseEntity<Map<String, Object>> addPrescription(@PathVariable String id,
                                                               @RequestBody PrescriptionItem item) {
        Appointment updated = appointmentService.addPrescription(id, item);
        return ResponseEntity.ok(Map.of("success", true, "message", "Prescription added", "data", updated));
    }
}
