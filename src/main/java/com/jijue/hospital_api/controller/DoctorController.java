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

import com.jijue.hospital_api.dto.AvailabilityToggleRequest;
import com.jijue.hospital_api.dto.DoctorSearchCriteria;
import com.jijue.hospital_api.dto.DoctorUpdateRequest;
import com.jijue.hospital_api.dto.PageResult;
import com.jijue.hospital_api.dto.RatingRequest;
import com.jijue.hospital_api.model.AvailabilityCheck;
import com.jijue.hospital_api.model.Doctor;
import com.jijue.hospital_api.model.Qualification;
import com.jijue.hospital_api.security.AccessGuard;
import com.jijue.hospital_api.service.DoctorService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/doctors")
@RequiredArgsConstructor
public class DoctorController {

    private static final Logger logger = LoggerFactory.getLogger(DoctorController.class);

    private final DoctorService doctorService;
    private final AccessGuard accessGuard;

    @GetMapping
    public ResponseEntity<Map<String, Object>> getDoctors(
            @RequestParam(required = false) String specialization,
            @RequestParam(required = false) String department,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer experience,
            @RequestParam(required = false) Double rating,
            @RequestParam(required = false) String language,
            @RequestParam(required = false) Boolean available,
            @RequestParam(required = false) Boolean verified,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "rating") String sortBy,
            @RequestParam(defaultValue = "desc") String sortOrder) {
        PageResult<Doctor> result = doctorService.searchDoctors(new DoctorSearchCriteria(
                specialization, department, search, experience, rating, language, available, verified,
                page, limit, sortBy, sortOrder));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("doctors", result.items());
        body.put("pagination", result.pagination().describe("totalDoctors"));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/available")
    public ResponseEntity<Map<String, Object>> getAvailableDoctors() {
        List<Doctor> doctors = doctorService.getAvailableDoctors();
        return ResponseEntity.ok(Map.of("success", true, "count", doctors.size(), "data", doctors));
    }

    @GetMapping("/meta/specialties")
    public ResponseEntity<Map<String, Object>> getSpecialties() {
        return ResponseEntity.ok(Map.of("success", true, "data", doctorService.getSpecialties()));
    }

    @GetMapping("/meta/stats")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(Map.of("success", true, "data", doctorService.getStats()));
    }

    @GetMapping("/department/{departmentId}")
    public ResponseEntity<Map<String, Object>> getByDepartment(@PathVariable String departmentId) {
        List<Doctor> doctors = doctorService.getDoctorsByDepartment(departmentId);
        return ResponseEntity.ok(Map.of("success", true, "count", doctors.size(), "data", doctors));
    }

    @GetMapping("/by-doctorId/{doctorId}")
    public ResponseEntity<Map<String, Object>> getByDoctorId(@PathVariable String doctorId) {
        return ResponseEntity.ok(Map.of("success", true, "data", doctorService.getByDoctorId(doctorId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getDoctor(@PathVariable String id) {
        return ResponseEntity.ok(Map.of("success", true, "data", doctorService.resolve(id)));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> createDoctor(@RequestBody Doctor doctor) {
        logger.info("Creating doctor profile for {}", doctor.getEmail());
        Doctor saved = doctorService.createDoctor(doctor);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "success", true,
                "message", "Doctor created successfully",
                "data", saved));
    }

    @PutMapping("/{id}")
    @PreAuthorize("@accessGuard.canManageDoctor(authentication, #id)")
    public ResponseEntity<Map<String, Object>> updateDoctor(@PathVariable String id,
                                                            @RequestBody DoctorUpdateRequest request,
                                                            Authentication authentication) {
        Doctor updated = doctorService.updateDoctor(id, request, accessGuard.isAdmin(authentication));
        return ResponseEntity.ok(Map.of("success", true, "message", "Doctor updated successfully", "data", updated));
    }

    @GetMapping("/{id}/availability")
    public ResponseEntity<Map<String, Object>> getAvailability(
            @PathVariable String id,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("Date is required");
        }
        return ResponseEntity.ok(Map.of("success", true, "data", doctorService.getDaySchedule(id, date)));
    }

    @GetMapping("/{id}/availability/check")
    public ResponseEntity<Map<String, Object>> checkAvailability(
            @PathVariable String id,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String time) {
        if (date == null || time == null || time.isBlank()) {
            throw new IllegalArgumentException("Date and time are required");
        }
        AvailabilityCheck check = doctorService.checkAvailability(id, date, time);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("available", check.available());
        if (check.reason() != null) {
            data.put("reason", check.reason());
        }
        return ResponseEntity.ok(Map.of("success", true, "data", data));
    }

    @PatchMapping("/{id}/availability")
    @PreAuthorize("@accessGuard.canManageDoctor(authentication, #id)")
    public ResponseEntity<Map<String, Object>> setAvailability(@PathVariable String id,
                                                               @RequestBody AvailabilityToggleRequest request) {
        Doctor updated = doctorService.setAvailability(id, request.isAvailable());
        String message = updated.isAvailable() ? "Doctor is now available" : "Doctor is now unavailable";
        return ResponseEntity.ok(Map.of("success", true, "message", message, "data", updated));
    }

    @PostMapping("/{id}/qualifications")
    @PreAuthorize("@accessGuard.canManageDoctor(authentication, #id)")
    public ResponseEntity<Map<String, Object>> addQualification(@PathVariable String id,
                                                                @RequestBody Qualification qualification) {
        Doctor updated = doctorService.addQualification(id, qualification);
        return ResponseEntity.ok(Map.of("success", true, "message", "Qualification added successfully", "data", updated));
    }

    @PostMapping("/{id}/rating")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Map<String, Object>> rateDoctor(@PathVariable String id, @RequestBody RatingRequest request) {
        Doctor updated = doctorService.rateDoctor(id, request.rating());
        return ResponseEntity.ok(Map.of("success", true, "message", "Rating submitted successfully",
                "data", updated.getRating()));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> deactivateDoctor(@PathVariable String id) {
        doctorService.deactivateDoctor(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Doctor deactivated successfully"));
    }
}
