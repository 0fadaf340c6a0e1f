package com.jijue.hospital_api.dto;

/**
 * Patient portal login with email and national ID number instead of a password.
 */
public record PortalLoginRequest(String email, String idNumber) {
}
