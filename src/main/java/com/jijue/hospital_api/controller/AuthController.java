package com.jijue.hospital_api.controller;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.jijue.hospital_api.dto.AccountSummary;
import com.jijue.hospital_api.dto.AuthResponse;
import com.jijue.hospital_api.dto.LoginRequest;
import com.jijue.hospital_api.dto.SignupRequest;
import com.jijue.hospital_api.exception.GlobalExceptionHandler;
import com.jijue.hospital_api.model.Role;
import com.jijue.hospital_api.model.User;
import com.jijue.hospital_api.service.UserService;

import lombok.RequiredArgsConstructor;

/**
 * Password sign-up and sign-in for patients and doctors. Token handling is in
 * {@link UserService}; this class only maps outcomes to status codes.
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    private final UserService userService;

    @PostMapping("/patient/register")
    public ResponseEntity<AuthResponse> registerPatient(@RequestBody SignupRequest request,
                                                        @RequestHeader(value = "Origin", required = false) String origin) {
        logger.info("=== PATIENT REGISTER REQUEST ===");
        logger.info("Email: {}, origin: {}", request.email(), origin != null ? origin : "Unknown");
        AuthResponse response = userService.registerPatient(request);
        logger.info("=== PATIENT REGISTRATION SUCCESS === {}", response.user().patientId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/patient/login")
    public ResponseEntity<?> patientLogin(@RequestBody LoginRequest request,
                                          @RequestHeader(value = "Origin", required = false) String origin) {
        return login(request, Role.ROLE_PATIENT, origin);
    }

    @PostMapping("/doctor/login")
    public ResponseEntity<?> doctorLogin(@RequestBody LoginRequest request,
                                         @RequestHeader(value = "Origin", required = false) String origin) {
        return login(request, Role.ROLE_DOCTOR, origin);
    }

    @PostMapping("/staff/login")
    public ResponseEntity<Map<String, Object>> staffLogin() {
        logger.info("Staff login requested; not available.");
        return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED)
                .body(GlobalExceptionHandler.errorBody("Staff login is not available yet"));
    }

    @GetMapping("/verify")
    public ResponseEntity<Map<String, Object>> verify(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "valid", true,
                "user", AccountSummary.of(user)));
    }

    @GetMapping("/me")
    public ResponseEntity<Map<String, Object>> me(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(userService.currentAccount(user));
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, Object>> logout() {
        return ResponseEntity.ok(Map.of("success", true, "message", "Logged out successfully"));
    }

    private ResponseEntity<?> login(LoginRequest request, Role role, String origin) {
        logger.info("=== {} LOGIN REQUEST ===", role.label().toUpperCase());
        logger.info("Email: {}, origin: {}", request.email(), origin != null ? origin : "Unknown");
        try {
            AuthResponse response = userService.login(request, role);
            logger.info("=== LOGIN SUCCESS === {}", request.email());
            return ResponseEntity.ok(response);
        } catch (DisabledException e) {
            logger.warn("=== LOGIN FAILED (Account Disabled) === {}", request.email());
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(GlobalExceptionHandler.errorBody(e.getMessage()));
        } catch (BadCredentialsException e) {
            logger.warn("=== LOGIN FAILED (Invalid Credentials) === {}", request.email());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(GlobalExceptionHandler.errorBody(e.getMessage()));
        }
    }
}
