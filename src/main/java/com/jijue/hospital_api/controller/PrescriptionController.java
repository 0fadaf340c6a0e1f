package com.jijue.hospital_api.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.jijue.hospital_api.dto.PrescriptionStatusUpdate;
import com.jijue.hospital_api.model.Prescription;
import com.jijue.hospital_api.security.AccessGuard;
import com.jijue.hospital_api.service.PrescriptionService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/prescriptions")
@RequiredArgsConstructor
public class PrescriptionController {

    private final PrescriptionService prescriptionService;
    private final AccessGuard accessGuard;

    @GetMapping
    public ResponseEntity<Map<String, Object>> getPrescriptions(@RequestParam(required = false) String patientId,
                                                                @RequestParam(required = false) String status,
                                                                Authentication authentication) {
        String ownCode = accessGuard.patientScope(authentication);
        List<Prescription> prescriptions = prescriptionService.getPrescriptions(ownCode != null ? ownCode : patientId, status);
        return ResponseEntity.ok(Map.of("success", true, "count", prescriptions.size(), "data", prescriptions));
    }

    @PatchMapping("/{id}/status")
    @PreAuthorize("hasAnyRole('DOCTOR', 'ADMIN')")
    public ResponseEntity<Map<String, Object>> updateStatus(@PathVariable String id,
                                                            @RequestBody PrescriptionStatusUpdate request) {
        Prescription updated = prescriptionService.updateStatus(id, request);
        return ResponseEntity.ok(Map.of("success", true, "message", "Prescription updated successfully", "data", updated));
    }
}
