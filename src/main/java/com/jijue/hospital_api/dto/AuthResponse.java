package com.jijue.hospital_api.dto;

/**
 * Sent back on successful login or registration.
 */
public record AuthResponse(boolean success, String message, String token, String role, AccountSummary user) {
}
