package com.jijue.hospital_api.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

import com.jijue.hospital_api.model.Role;
import com.jijue.hospital_api.model.User;

/**
 * Ownership checks used from {@code @PreAuthorize} expressions and controllers.
 * Staff (doctors, admins) see every patient; a patient sees only their own records;
 * a doctor may edit only their own profile.
 */
@Component("accessGuard")
public class AccessGuard {

    public boolean canAccessPatient(Authentication authentication, String patientId) {
        User user = currentUser(authentication);
        if (user == null) {
            return false;
        }
        if (user.hasRole(Role.ROLE_ADMIN) || user.hasRole(Role.ROLE_DOCTOR)) {
            return true;
        }
        return user.hasRole(Role.ROLE_PATIENT) && patientId != null && patientId.equals(user.getCode());
    }

    public boolean canManageDoctor(Authentication authentication, String doctorId) {
        User user = currentUser(authentication);
        if (user == null) {
            return false;
        }
        if (user.hasRole(Role.ROLE_ADMIN)) {
            return true;
        }
        return user.hasRole(Role.ROLE_DOCTOR)
                && doctorId != null
                && (doctorId.equals(user.getProfileId()) || doctorId.equals(user.getCode()));
    }

    /** True for staff, or for a patient whose own profile document has this database id. */
    public boolean canAccessProfile(Authentication authentication, String profileId) {
        User user = currentUser(authentication);
        if (user == null) {
            return false;
        }
        if (user.hasRole(Role.ROLE_ADMIN) || user.hasRole(Role.ROLE_DOCTOR)) {
            return true;
        }
        return profileId != null && profileId.equals(user.getProfileId());
    }

    public void requirePatientAccess(Authentication authentication, String patientId) {
        if (!canAccessPatient(authentication, patientId)) {
            throw new AccessDeniedException("Not allowed to access records of patient " + patientId);
        }
    }

    public boolean isAdmin(Authentication authentication) {
        User user = currentUser(authentication);
        return user != null && user.hasRole(Role.ROLE_ADMIN);
    }

    /** The patient code of the caller when the caller is a patient, otherwise {@code null}. */
    public String patientScope(Authentication authentication) {
        User user = currentUser(authentication);
        return user != null && user.hasRole(Role.ROLE_PATIENT) ? user.getCode() : null;
    }

    public User currentUser(Authentication authentication) {
        if (authentication == null || !(authentication.getPrincipal() instanceof User user)) {
            return null;
        }
        return user;
    }
}
