package com.jijue.hospital_api.dto;

/**
 * Identifies the prescription to refill either by id or by medication name.
 */
public record RefillRequest(String prescriptionId, String medication) {
}
