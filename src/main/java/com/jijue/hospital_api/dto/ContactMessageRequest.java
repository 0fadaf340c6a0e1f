package com.jijue.hospital_api.dto;

public record ContactMessageRequest(
        String name,
        String email,
        String phone,
        String subject,
        String department,
        String message,
        String source) {
}
