package com.jijue.hospital_api.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;

import com.jijue.hospital_api.model.Role;
import com.jijue.hospital_api.model.User;

class AccessGuardTest {

    private final AccessGuard accessGuard = new AccessGuard();

    private static Authentication as(Role role, String profileId, String code) {
        User user = new User(role.label() + "@jijue.test", "hashed", role);
        user.setProfileId(profileId);
        user.setCode(code);
        return new UsernamePasswordAuthenticationToken(user, null, user.getAuthorities());
    }

    @Test
    void patientSeesOnlyOwnRecords() {
        Authentication patient = as(Role.ROLE_PATIENT, "p-1", "PAT111111111");

        assertThat(accessGuard.canAccessPatient(patient, "PAT111111111")).isTrue();
        assertThat(accessGuard.canAccessPatient(patient, "PAT222222222")).isFalse();
        assertThat(accessGuard.canAccessProfile(patient, "p-1")).isTrue();
        assertThat(accessGuard.canAccessProfile(patient, "p-2")).isFalse();
        assertThat(accessGuard.patientScope(patient)).isEqualTo("PAT111111111");
        assertThatThrownBy(() -> accessGuard.requirePatientAccess(patient, "PAT222222222"))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    void staffSeeEveryPatient() {
        assertThat(accessGuard.canAccessPatient(as(Role.ROLE_DOCTOR, "d-1", "DOC1"), "PAT222222222")).isTrue();
        assertThat(accessGuard.canAccessPatient(as(Role.ROLE_ADMIN, null, null), "PAT222222222")).isTrue();
        assertThat(accessGuard.patientScope(as(Role.ROLE_ADMIN, null, null))).isNull();
    }

    @Test
    void doctorManagesOnlyOwnProfile() {
        Authentication doctor = as(Role.ROLE_DOCTOR, "d-1", "DOC12345678ABCD");

        assertThat(accessGuard.canManageDoctor(doctor, "d-1")).isTrue();
        assertThat(accessGuard.canManageDoctor(doctor, "DOC12345678ABCD")).isTrue();
        assertThat(accessGuard.canManageDoctor(doctor, "d-2")).isFalse();
        assertThat(accessGuard.canManageDoctor(as(Role.ROLE_ADMIN, null, null), "d-2")).isTrue();
        assertThat(accessGuard.isAdmin(doctor)).isFalse();
    }

    @Test
    void anonymousCallerHasNoAccess() {
        assertThat(accessGuard.canAccessPatient(null, "PAT111111111")).isFalse();
        assertThat(accessGuard.currentUser(null)).isNull();
    }
}
