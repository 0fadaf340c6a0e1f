package com.jijue.hospital_api.dto;

public record PrescriptionStatusUpdate(String status, Integer refillsRemaining, String dosage, String frequency) {
}
