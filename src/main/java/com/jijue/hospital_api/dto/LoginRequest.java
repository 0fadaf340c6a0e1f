package com.jijue.hospital_api.dto;

/**
 * Email and password login used by patients and doctors.
 */
public record LoginRequest(String email, String password) {
}
