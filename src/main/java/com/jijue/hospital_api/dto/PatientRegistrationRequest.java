package com.jijue.hospital_api.dto;

import java.time.LocalDate;

/**
 * Full intake form submitted from the registration page. Enumerated answers
 * arrive as free strings and are normalized by the service.
 */
public record PatientRegistrationRequest(
        String firstName,
        String lastName,
        LocalDate dateOfBirth,
        String gender,
        String idNumber,
        String email,
        String phone,
        String alternatePhone,
        String address,
        String city,
        String postalCode,
        String bloodType,
        String allergies,
        String conditions,
        String medications,
        String familyHistory,
        String surgicalHistory,
        String emergencyContactName,
        String emergencyContactPhone,
        String emergencyContactRelationship,
        String paymentMethod,
        String insuranceProvider,
        String policyNumber,
        String maritalStatus,
        String nationality,
        String occupation,
        String preferredLanguage,
        boolean termsAccepted,
        boolean privacyAccepted,
        boolean marketingConsent) {
}
