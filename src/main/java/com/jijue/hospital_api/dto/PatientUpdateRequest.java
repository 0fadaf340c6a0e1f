package com.jijue.hospital_api.dto;

import java.time.LocalDate;

import com.jijue.hospital_api.model.EmergencyContact;

/**
 * Partial patient update through {@code PUT /api/patients/{id}}. Null means "leave as is".
 * Identity and account fields (names, birth date, gender, ID number, email, blood type,
 * nationality, status) are honoured for administrators only; everyone else is limited
 * to the fields of {@link ProfileUpdateRequest}.
 */
public record PatientUpdateRequest(
        String firstName,
        String lastName,
        LocalDate dateOfBirth,
        String gender,
        String idNumber,
        String email,
        String bloodType,
        String nationality,
        String status,
        String phone,
        String alternatePhone,
        String address,
        String city,
        String postalCode,
        EmergencyContact emergencyContact,
        String paymentMethod,
        String insuranceProvider,
        String policyNumber,
        String maritalStatus,
        String occupation,
        String preferredLanguage,
        String allergies,
        String conditions,
        String medications,
        String familyHistory,
        String surgicalHistory,
        Boolean marketingConsent) {

    public boolean touchesAdministrativeFields() {
        return firstName != null || lastName != null || dateOfBirth != null || gender != null
                || idNumber != null || email != null || bloodType != null || nationality != null
                || status != null;
    }

    public ProfileUpdateRequest profile() {
        return new ProfileUpdateRequest(phone, alternatePhone, address, city, postalCode, emergencyContact,
                paymentMethod, insuranceProvider, policyNumber, maritalStatus, occupation, preferredLanguage,
                allergies, conditions, medications, familyHistory, surgicalHistory, marketingConsent);
    }
}
