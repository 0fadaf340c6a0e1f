package com.jijue.hospital_api.dto;

import java.time.LocalDate;

/**
 * Quick patient sign-up that creates a password-protected account.
 */
public record SignupRequest(
        String firstName,
        String lastName,
        String email,
        String password,
        String phone,
        LocalDate dateOfBirth,
        String gender,
        String address) {
}
