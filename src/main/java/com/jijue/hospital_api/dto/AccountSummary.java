package com.jijue.hospital_api.dto;

import com.jijue.hospital_api.model.Role;
import com.jijue.hospital_api.model.User;

public record AccountSummary(
        String id,
        String firstName,
        String lastName,
        String email,
        String role,
        String patientId,
        String doctorId) {

    public static AccountSummary of(User user) {
        String id = user.getProfileId() != null ? user.getProfileId() : user.getId();
        return new AccountSummary(
                id,
                user.getFirstName(),
                user.getLastName(),
                user.getUsername(),
                user.getRole().label(),
                user.hasRole(Role.ROLE_PATIENT) ? user.getCode() : null,
                user.hasRole(Role.ROLE_DOCTOR) ? user.getCode() : null);
    }
}
