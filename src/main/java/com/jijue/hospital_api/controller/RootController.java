package com.jijue.hospital_api.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
            "service", "jijue-hospital-api",
            "status", "running",
            "version", "1.0.0",
            "endpoints", Map.of(
                "health", "/api/health",
                "auth", "/api/auth/patient/login, /api/auth/doctor/login, /api/auth/patient/register",
                "patients", "/api/patients",
                "doctors", "/api/doctors",
                "departments", "/api/departments",
                "appointments", "/api/appointments",
                "services", "/api/services",
                "contact", "/api/contact"
            ),
            "message", "Jijue Hospital API is running. Use /api/health for health check."
        ));
    }
}
