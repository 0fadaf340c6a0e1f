package com.jijue.hospital_api.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.dto.AccountSummary;
import com.jijue.hospital_api.dto.AuthResponse;
import com.jijue.hospital_api.dto.LoginRequest;
import com.jijue.hospital_api.dto.PortalLoginRequest;
import com.jijue.hospital_api.dto.SignupRequest;
import com.jijue.hospital_api.model.Doctor;
import com.jijue.hospital_api.model.DoctorStatus;
import com.jijue.hospital_api.model.Gender;
import com.jijue.hospital_api.model.Patient;
import com.jijue.hospital_api.model.PatientStatus;
import com.jijue.hospital_api.model.Role;
import com.jijue.hospital_api.model.User;
import com.jijue.hospital_api.repository.DoctorRepository;
import com.jijue.hospital_api.repository.PatientRepository;
import com.jijue.hospital_api.repository.UserRepository;
import com.jijue.hospital_api.security.JwtService;
import com.jijue.hospital_api.util.BusinessIds;

import lombok.RequiredArgsConstructor;

/**
 * Login accounts and token issuing for patients, doctors and administrators.
 */
@Service
@RequiredArgsConstructor
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    static final String ACCOUNT_EXISTS = "An account with this email already exists";
    static final String DEACTIVATED = "Account is deactivated. Please contact hospital administration.";

    private final UserRepository userRepository;
    private final PatientRepository patientRepository;
    private final DoctorRepository doctorRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuthenticationManager authenticationManager;
    private final JwtService jwtService;
    private final Clock clock;

    public AuthResponse registerPatient(SignupRequest request) {
        if (isBlank(request.firstName()) || isBlank(request.lastName()) || isBlank(request.email())
                || isBlank(request.password()) || isBlank(request.phone())) {
            throw new IllegalArgumentException("First name, last name, email, password, and phone are required");
        }
        if (request.password().length() < 8) {
            logger.warn("Registration password too short for {}", request.email());
            throw new IllegalArgumentException("Password must be at least 8 characters long");
        }
        String email = normalizeEmail(request.email());
        logger.info("Registering patient account {}", email);
        if (userRepository.existsByUsername(email) || patientRepository.existsByEmail(email)) {
            logger.warn("Patient email {} already registered.", email);
            throw new IllegalArgumentException("Patient with this email already exists");
        }

        Instant now = clock.instant();
        Patient patient = new Patient(request.firstName(), request.lastName(), request.dateOfBirth(), email);
        patient.setPhone(request.phone().trim());
        patient.setAddress(request.address());
        if (!isBlank(request.gender())) {
            patient.setGender(Gender.fromValue(request.gender()));
        }
        patient.setPatientId(BusinessIds.patientId(clock.millis()));
        patient.setRegistrationDate(now);
        patient.setCreatedAt(now);
        patient.setUpdatedAt(now);
        patient.setLastLogin(now);
        patient.prepareForSave(LocalDate.now(clock));
        Patient saved = patientRepository.save(patient);

        User user = newAccount(email, request.password(), Role.ROLE_PATIENT);
        link(user, saved);
        user.setLastLogin(now);
        User savedUser = userRepository.save(user);
        logger.info("Patient {} registered with account {}", saved.getPatientId(), savedUser.getId());
        return issueToken(savedUser, "Registration successful");
    }

    /**
     * Password login restricted to one role: a doctor account cannot sign in
     * through the patient form and vice versa.
     */
    public AuthResponse login(LoginRequest request, Role expected) {
        if (isBlank(request.email()) || isBlank(request.password())) {
            throw new IllegalArgumentException("Email and password are required");
        }
        String email = normalizeEmail(request.email());
        logger.info("Attempting {} login for {}", expected.label(), email);
        User user;
        try {
            Authentication authentication = authenticationManager.authenticate(
                    new UsernamePasswordAuthenticationToken(email, request.password())
            );
            user = (User) authentication.getPrincipal();
        } catch (DisabledException e) {
            logger.warn("Login attempt for disabled account {}", email);
            throw new DisabledException(DEACTIVATED);
        } catch (AuthenticationException e) {
            logger.warn("Invalid credentials for {}: {}", email, e.getMessage());
            throw new BadCredentialsException("Invalid credentials");
        }

        if (!user.hasRole(expected)) {
            logger.warn("Account {} has role {}, not {}", email, user.getRole(), expected);
            throw new BadCredentialsException("Invalid credentials");
        }

        Instant now = clock.instant();
        if (expected == Role.ROLE_PATIENT && user.getProfileId() != null) {
            patientRepository.findById(user.getProfileId()).ifPresent(patient -> {
                if (patient.getStatus() != PatientStatus.ACTIVE) {
                    throw new DisabledException(DEACTIVATED);
                }
                patient.setLastLogin(now);
                patientRepository.save(patient);
            });
        }
        if (expected == Role.ROLE_DOCTOR && user.getProfileId() != null) {
            doctorRepository.findById(user.getProfileId()).ifPresent(doctor -> {
                if (doctor.getStatus() == DoctorStatus.INACTIVE || doctor.getStatus() == DoctorStatus.SUSPENDED) {
                    throw new DisabledException(DEACTIVATED);
                }
                doctor.setLastActive(now);
                doctorRepository.save(doctor);
            });
        }

        user.setLastLogin(now);
        userRepository.save(user);
        logger.info("Login successful for {}", email);
        return issueToken(user, "Login successful");
    }

    /**
     * Patient portal sign-in with email and national ID number instead of a password.
     */
    public AuthResponse loginWithIdNumber(PortalLoginRequest request) {
        if (isBlank(request.email()) || isBlank(request.idNumber())) {
            throw new IllegalArgumentException("Email and ID number are required");
        }
        String email = normalizeEmail(request.email());
        Patient patient = patientRepository.findByEmailAndIdNumber(email, request.idNumber().trim())
                .orElseThrow(() -> {
                    logger.warn("Portal login failed for {}", email);
                    return new BadCredentialsException("Invalid email or ID number");
                });
        if (patient.getStatus() != PatientStatus.ACTIVE) {
            logger.warn("Portal login for non-active patient {}", patient.getPatientId());
            throw new DisabledException("Account is not active");
        }
        Instant now = clock.instant();
        patient.setLastLogin(now);
        patientRepository.save(patient);

        User user = ensurePatientAccount(patient);
        user.setLastLogin(now);
        userRepository.save(user);
        logger.info("Patient {} signed in to the portal", patient.getPatientId());
        return issueToken(user, "Login successful");
    }

    /**
     * Returns the account linked to the patient, creating one with a random
     * password when the patient registered through the intake form.
     */
    public User ensurePatientAccount(Patient patient) {
        return userRepository.findByProfileId(patient.getId()).orElseGet(() -> {
            User user = userRepository.findByUsername(patient.getEmail())
                    .orElseGet(() -> newAccount(patient.getEmail(), UUID.randomUUID().toString(), Role.ROLE_PATIENT));
            if (!user.hasRole(Role.ROLE_PATIENT)) {
                throw new IllegalArgumentException("Email " + patient.getEmail() + " belongs to a staff account");
            }
            link(user, patient);
            User saved = userRepository.save(user);
            logger.info("Created portal account for patient {}", patient.getPatientId());
            return saved;
        });
    }

    /**
     * Fails when {@code email} already has a login, so callers can check before
     * persisting anything that the account would link to.
     */
    public void ensureAccountAvailable(String email) {
        if (userRepository.existsByUsername(normalizeEmail(email))) {
            logger.warn("Login account for {} already exists", email);
            throw new IllegalArgumentException(ACCOUNT_EXISTS);
        }
    }

    public User createDoctorAccount(Doctor doctor, String password) {
        if (password == null || password.length() < 8) {
            throw new IllegalArgumentException("Password must be at least 8 characters long");
        }
        ensureAccountAvailable(doctor.getEmail());
        User user = newAccount(doctor.getEmail(), password, Role.ROLE_DOCTOR);
        user.setProfileId(doctor.getId());
        user.setCode(doctor.getDoctorId());
        user.setFirstName(doctor.getName());
        User saved = userRepository.save(user);
        logger.info("Created login account for doctor {}", doctor.getDoctorId());
        return saved;
    }

    /**
     * @return true when a new administrator account was created
     */
    public boolean ensureAdmin(String email, String password) {
        String username = normalizeEmail(email);
        if (userRepository.existsByUsername(username)) {
            return false;
        }
        if (password.length() < 8) {
            throw new IllegalArgumentException("Administrator password must be at least 8 characters long");
        }
        User admin = newAccount(username, password, Role.ROLE_ADMIN);
        admin.setFirstName("System");
        admin.setLastName("Administrator");
        userRepository.save(admin);
        return true;
    }

    public AuthResponse issueToken(User user, String message) {
        String token = jwtService.generateAccountToken(user);
        return new AuthResponse(true, message, token, user.getRole().label(), AccountSummary.of(user));
    }

    /**
     * The account summary plus the linked patient or doctor document.
     */
    public Map<String, Object> currentAccount(User user) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("user", AccountSummary.of(user));
        if (user.getProfileId() != null) {
            if (user.hasRole(Role.ROLE_PATIENT)) {
                patientRepository.findById(user.getProfileId()).ifPresent(p -> {
                    p.refreshAge(LocalDate.now(clock));
                    body.put("profile", p);
                });
            } else if (user.hasRole(Role.ROLE_DOCTOR)) {
                doctorRepository.findById(user.getProfileId()).ifPresent(d -> body.put("profile", d));
            }
        }
        return body;
    }

    private User newAccount(String email, String rawPassword, Role role) {
        User user = new User(email, passwordEncoder.encode(rawPassword), role);
        user.setCreatedAt(clock.instant());
        return user;
    }

    private static void link(User user, Patient patient) {
        user.setProfileId(patient.getId());
        user.setCode(patient.getPatientId());
        user.setFirstName(patient.getFirstName());
        user.setLastName(patient.getLastName());
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase();
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
