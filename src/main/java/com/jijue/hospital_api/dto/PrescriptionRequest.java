package com.jijue.hospital_api.dto;

public record PrescriptionRequest(String medication, String reason, String dosage, String instructions) {
}
