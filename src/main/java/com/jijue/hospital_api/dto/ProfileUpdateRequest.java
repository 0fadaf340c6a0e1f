package com.jijue.hospital_api.dto;

import com.jijue.hospital_api.model.EmergencyContact;

/**
 * Fields a patient may change from the dashboard. Null means "leave as is".
 */
public record ProfileUpdateRequest(
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
}
