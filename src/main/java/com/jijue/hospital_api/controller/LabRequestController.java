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

import com.jijue.hospital_api.dto.LabRequestUpdate;
import com.jijue.hospital_api.model.LabRequest;
import com.jijue.hospital_api.security.AccessGuard;
import com.jijue.hospital_api.service.LabRequestService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/lab-requests")
@RequiredArgsConstructor
public class LabRequestController {

    private final LabRequestService labRequestService;
    private final AccessGuard accessGuard;

    @GetMapping
    public ResponseEntity<Map<String, Object>> getLabRequests(@RequestParam(required = false) String patientId,
                                                              @RequestParam(required = false) String status,
                                                              Authentication authentication) {
        String ownCode = accessGuard.patientScope(authentication);
        List<LabRequest> requests = labRequestService.getLabRequests(ownCode != null ? ownCode : patientId, status);
        return ResponseEntity.ok(Map.of("success", true, "count", requests.size(), "data", requests));
    }

    @PatchMapping("/{id}")
    @PreAuthorize("hasAnyRole('DOCTOR', 'ADMIN')")
    public ResponseEntity<Map<String, Object>> updateLabRequest(@PathVariable String id,
                                                                @RequestBody LabRequestUpdate request) {
        LabRequest updated = labRequestService.updateLabRequest(id, request);
        return ResponseEntity.ok(Map.of("success", true, "message", "Lab request updated successfully", "data", updated));
    }
}
