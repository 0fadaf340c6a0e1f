package com.jijue.hospital_api.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import com.jijue.hospital_api.model.Role;
import com.jijue.hospital_api.model.User;

class JwtServiceTest {

    private JwtService jwtService;
    private User patient;

    @BeforeEach
    void setUp() {
        jwtService = new JwtService();
        ReflectionTestUtils.setField(jwtService, "secretKeyString", "unit-test-secret");
        patient = new User("wanjiku@jijue.test", "hashed", Role.ROLE_PATIENT);
    }

    @Test
    void tokenCarriesSubjectRoleAndProfileClaims() {
        patient.setProfileId("p-1");
        patient.setCode("PAT123456789");
        String token = jwtService.generateAccountToken(patient);

        String code = jwtService.extractClaim(token, claims -> claims.get(JwtService.CODE_CLAIM, String.class));
        String profileId = jwtService.extractClaim(token, claims -> claims.get(JwtService.PROFILE_CLAIM, String.class));

        assertThat(jwtService.extractUsername(token)).isEqualTo("wanjiku@jijue.test");
        assertThat(jwtService.extractRole(token)).isEqualTo("ROLE_PATIENT");
        assertThat(code).isEqualTo("PAT123456789");
        assertThat(profileId).isEqualTo("p-1");
        assertThat(jwtService.isTokenValid(token, patient)).isTrue();
    }

    @Test
    void tokenOfAnotherUserIsNotValid() {
        String token = jwtService.generateToken(patient);
        User other = new User("someone@jijue.test", "hashed", Role.ROLE_PATIENT);

        assertThat(jwtService.isTokenValid(token, other)).isFalse();
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        JwtService foreign = new JwtService();
        ReflectionTestUtils.setField(foreign, "secretKeyString", "some-other-secret");
        String token = foreign.generateToken(patient);

        assertThat(jwtService.isTokenValid(token, patient)).isFalse();
    }

    @Test
    void missingSecretFailsLoudly() {
        ReflectionTestUtils.setField(jwtService, "secretKeyString", "");

        assertThatThrownBy(() -> jwtService.generateToken(patient))
                .isInstanceOf(IllegalStateException.class);
    }
}
