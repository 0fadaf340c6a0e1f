package com.jijue.hospital_api.dto;

import java.util.List;

import com.jijue.hospital_api.model.Availability;
import com.jijue.hospital_api.model.DoctorPreferences;

/**
 * Partial doctor profile update. Null means "leave as is". {@code licenseNumber},
 * {@code status} and {@code verified} are honoured for administrators only.
 */
public record DoctorUpdateRequest(
        String name,
        String specialization,
        String licenseNumber,
        Integer yearsOfExperience,
        String bio,
        Double consultationFee,
        Availability availability,
        Boolean isAvailable,
        String email,
        String phone,
        String address,
        String profileImage,
        List<String> languages,
        String department,
        String status,
        Boolean verified,
        DoctorPreferences preferences) {
}
