package com.jijue.hospital_api.dto;

public record LabWorkRequest(String testType, String reason, String urgency, String notes) {
}
