package com.jijue.hospital_api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.jijue.hospital_api.dto.AuthResponse;
import com.jijue.hospital_api.dto.LoginRequest;
import com.jijue.hospital_api.dto.PortalLoginRequest;
import com.jijue.hospital_api.dto.SignupRequest;
import com.jijue.hospital_api.model.Patient;
import com.jijue.hospital_api.model.Role;
import com.jijue.hospital_api.model.User;
import com.jijue.hospital_api.repository.DoctorRepository;
import com.jijue.hospital_api.repository.PatientRepository;
import com.jijue.hospital_api.repository.UserRepository;
import com.jijue.hospital_api.security.JwtService;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private PatientRepository patientRepository;
    @Mock
    private DoctorRepository doctorRepository;
    @Mock
    private PasswordEncoder passwordEncoder;
    @Mock
    private AuthenticationManager authenticationManager;
    @Mock
    private JwtService jwtService;

    private UserService userService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-10T05:00:00Z"), ZoneId.of("Africa/Nairobi"));
        userService = new UserService(userRepository, patientRepository, doctorRepository, passwordEncoder,
                authenticationManager, jwtService, clock);
    }

    private static SignupRequest signup(String password) {
        return new SignupRequest("Mercy", "Njeri", " Mercy@Example.com ", password, "+254700000001",
                null, "female", "Moi Avenue");
    }

    @Test
    void shortPasswordIsRejected() {
        assertThatThrownBy(() -> userService.registerPatient(signup("short")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Password must be at least 8 characters long");
    }

    @Test
    void duplicateEmailIsRejected() {
        when(userRepository.existsByUsername("mercy@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.registerPatient(signup("longenough")))
                .hasMessage("Patient with this email already exists");
        verify(patientRepository, never()).save(any());
    }

    @Test
    void registrationCreatesLinkedPatientAndAccount() {
        when(userRepository.existsByUsername("mercy@example.com")).thenReturn(false);
        when(patientRepository.existsByEmail("mercy@example.com")).thenReturn(false);
        when(patientRepository.save(any(Patient.class))).thenAnswer(invocation -> {
            Patient patient = invocation.getArgument(0);
            patient.setId("p-1");
            return patient;
        });
        when(passwordEncoder.encode("longenough")).thenReturn("hashed");
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(jwtService.generateAccountToken(any(User.class))).thenReturn("signed-token");

        AuthResponse response = userService.registerPatient(signup("longenough"));

        assertThat(response.token()).isEqualTo("signed-token");
        assertThat(response.role()).isEqualTo("patient");
        assertThat(response.user().email()).isEqualTo("mercy@example.com");
        assertThat(response.user().id()).isEqualTo("p-1");
        assertThat(response.user().patientId()).startsWith("PAT");
    }

    @Test
    void loginThroughTheWrongFormIsRejected() {
        User doctor = new User("doc@jijue.test", "hashed", Role.ROLE_DOCTOR);
        when(authenticationManager.authenticate(any()))
                .thenReturn(new UsernamePasswordAuthenticationToken(doctor, null, doctor.getAuthorities()));

        assertThatThrownBy(() -> userService.login(new LoginRequest("doc@jijue.test", "secret123"), Role.ROLE_PATIENT))
                .isInstanceOf(BadCredentialsException.class)
                .hasMessage("Invalid credentials");
    }

    @Test
    void disabledAccountGetsDeactivationMessage() {
        when(authenticationManager.authenticate(any())).thenThrow(new DisabledException("User is disabled"));

        assertThatThrownBy(() -> userService.login(new LoginRequest("x@jijue.test", "secret123"), Role.ROLE_PATIENT))
                .isInstanceOf(DisabledException.class)
                .hasMessage(UserService.DEACTIVATED);
    }

    @Test
    void wrongPasswordBecomesGenericFailure() {
        when(authenticationManager.authenticate(any())).thenThrow(new BadCredentialsException("Bad credentials"));

        assertThatThrownBy(() -> userService.login(new LoginRequest("x@jijue.test", "nope"), Role.ROLE_DOCTOR))
                .isInstanceOf(BadCredentialsException.class)
                .hasMessage("Invalid credentials");
    }

    @Test
    void portalLoginNeedsMatchingIdNumber() {
        when(patientRepository.findByEmailAndIdNumber("a@b.test", "12345678")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> userService.loginWithIdNumber(new PortalLoginRequest("A@b.test", "12345678")))
                .isInstanceOf(BadCredentialsException.class)
                .hasMessage("Invalid email or ID number");
    }

    @Test
    void existingPortalAccountIsReused() {
        Patient patient = new Patient("A", "B", null, "a@b.test");
        patient.setId("p-9");
        User account = new User("a@b.test", "hashed", Role.ROLE_PATIENT);
        when(userRepository.findByProfileId("p-9")).thenReturn(Optional.of(account));

        assertThat(userService.ensurePatientAccount(patient)).isSameAs(account);
        verify(userRepository, never()).save(any());
    }

    @Test
    void staffEmailCannotBecomePatientAccount() {
        Patient patient = new Patient("A", "B", null, "admin@jijue.test");
        patient.setId("p-9");
        when(userRepository.findByProfileId("p-9")).thenReturn(Optional.empty());
        when(userRepository.findByUsername("admin@jijue.test"))
                .thenReturn(Optional.of(new User("admin@jijue.test", "hashed", Role.ROLE_ADMIN)));

        assertThatThrownBy(() -> userService.ensurePatientAccount(patient))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
