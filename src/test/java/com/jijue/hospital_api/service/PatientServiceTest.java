package com.jijue.hospital_api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.NoSuchElementException;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.jijue.hospital_api.dto.PatientRegistrationRequest;
import com.jijue.hospital_api.dto.PatientUpdateRequest;
import com.jijue.hospital_api.dto.ProfileUpdateRequest;
import com.jijue.hospital_api.model.Allergy;
import com.jijue.hospital_api.model.BloodType;
import com.jijue.hospital_api.model.Gender;
import com.jijue.hospital_api.model.Patient;
import com.jijue.hospital_api.model.PatientStatus;
import com.jijue.hospital_api.model.PaymentMethod;
import com.jijue.hospital_api.repository.PatientRepository;

@ExtendWith(MockitoExtension.class)
class PatientServiceTest {

    @Mock
    private PatientRepository patientRepository;

    private PatientService patientService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-10T05:00:00Z"), ZoneId.of("Africa/Nairobi"));
        patientService = new PatientService(patientRepository, clock);
    }

    private static PatientRegistrationRequest intake(LocalDate dateOfBirth, String city) {
        return new PatientRegistrationRequest("Brian", "Mutua", dateOfBirth, "male", "30123456",
                "Brian.Mutua@Example.com", "+254711000111", null, "Kenyatta Avenue 4", city, "00100",
                "o +", "Penicillin", "Hypertension, Asthma", null, null, null,
                "Ruth Mutua", "+254722000222", "spouse", "insurance", "NHIF", "P-778",
                "married", "Kenyan", "Teacher", "English", true, true, false);
    }

    @Test
    void intakeFormCreatesStructuredPatient() {
        when(patientRepository.existsByEmail("brian.mutua@example.com")).thenReturn(false);
        when(patientRepository.existsByIdNumber("30123456")).thenReturn(false);
        when(patientRepository.save(any(Patient.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Patient saved = patientService.register(intake(LocalDate.of(1988, 2, 29), "Nairobi"));

        assertThat(saved.getPatientId()).startsWith("PAT");
        assertThat(saved.getEmail()).isEqualTo("brian.mutua@example.com");
        assertThat(saved.getGender()).isEqualTo(Gender.MALE);
        assertThat(saved.getBloodType()).isEqualTo(BloodType.O_POSITIVE);
        assertThat(saved.getPaymentMethod()).isEqualTo(PaymentMethod.INSURANCE);
        assertThat(saved.getMedicalHistory()).hasSize(2);
        assertThat(saved.getAllergies()).hasSize(1);
        assertThat(saved.getEmergencyContact().getName()).isEqualTo("Ruth Mutua");
        assertThat(saved.ageOn(LocalDate.of(2024, 6, 10))).isEqualTo(36);
    }

    @Test
    void missingIntakeFieldsAreNamed() {
        assertThatThrownBy(() -> patientService.register(intake(null, " ")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required fields: dateOfBirth, city");
    }

    @Test
    void futureBirthDateIsRejected() {
        assertThatThrownBy(() -> patientService.register(intake(LocalDate.of(2030, 1, 1), "Nairobi")))
                .hasMessage("Date of birth cannot be in the future");
    }

    @Test
    void duplicateIdNumberIsRejected() {
        when(patientRepository.existsByEmail("brian.mutua@example.com")).thenReturn(false);
        when(patientRepository.existsByIdNumber("30123456")).thenReturn(true);

        assertThatThrownBy(() -> patientService.register(intake(LocalDate.of(1988, 2, 29), "Nairobi")))
                .hasMessage(PatientService.DUPLICATE);
        verify(patientRepository, never()).save(any());
    }

    private static PatientUpdateRequest update(String lastName, String idNumber, String status, String phone,
                                               String allergies) {
        return new PatientUpdateRequest(null, lastName, null, null, idNumber, null, null, null, status,
                phone, null, null, null, null, null, null, null, null, null, null, null,
                allergies, null, null, null, null, null);
    }

    private Patient suspendedBrian() {
        Patient existing = new Patient("Brian", "Mutua", LocalDate.of(1990, 1, 1), "brian@example.com");
        existing.setId("p-1");
        existing.setPatientId("PAT000111222");
        existing.setIdNumber("30123456");
        existing.setStatus(PatientStatus.SUSPENDED);
        when(patientRepository.findById("p-1")).thenReturn(Optional.of(existing));
        when(patientRepository.save(any(Patient.class))).thenAnswer(invocation -> invocation.getArgument(0));
        return existing;
    }

    @Test
    void partialUpdateLeavesUnsentFieldsAlone() {
        suspendedBrian();

        Patient updated = patientService.updatePatient("p-1", update(null, null, null, "+254700000000", null), true);

        assertThat(updated.getPhone()).isEqualTo("+254700000000");
        assertThat(updated.getFirstName()).isEqualTo("Brian");
        assertThat(updated.getDateOfBirth()).isEqualTo(LocalDate.of(1990, 1, 1));
        assertThat(updated.getIdNumber()).isEqualTo("30123456");
        assertThat(updated.getPatientId()).isEqualTo("PAT000111222");
        assertThat(updated.getStatus()).isEqualTo(PatientStatus.SUSPENDED);
    }

    @Test
    void adminMayChangeIdentityAndStatus() {
        suspendedBrian();
        when(patientRepository.existsByIdNumber("30999999")).thenReturn(false);

        Patient updated = patientService.updatePatient("p-1", update("Mutua-Kilonzo", "30999999", "active", null, null), true);

        assertThat(updated.getLastName()).isEqualTo("Mutua-Kilonzo");
        assertThat(updated.getIdNumber()).isEqualTo("30999999");
        assertThat(updated.getStatus()).isEqualTo(PatientStatus.ACTIVE);
    }

    @Test
    void patientCannotReactivateOrChangeLoginIdThemselves() {
        suspendedBrian();

        Patient updated = patientService.updatePatient("p-1",
                update("Other", "11111111", "active", "+254700000000", null), false);

        assertThat(updated.getStatus()).isEqualTo(PatientStatus.SUSPENDED);
        assertThat(updated.getIdNumber()).isEqualTo("30123456");
        assertThat(updated.getLastName()).isEqualTo("Mutua");
        assertThat(updated.getPhone()).isEqualTo("+254700000000");
        verify(patientRepository, never()).existsByIdNumber(any());
    }

    @Test
    void profileUpdateTouchesOnlyDashboardFields() {
        Patient existing = new Patient("Brian", "Mutua", LocalDate.of(1990, 1, 1), "brian@example.com");
        existing.setPatientId("PAT000111222");
        existing.setIdNumber("30123456");
        existing.setCity("Nairobi");
        when(patientRepository.findByPatientId("PAT000111222")).thenReturn(Optional.of(existing));
        when(patientRepository.save(any(Patient.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ProfileUpdateRequest request = new ProfileUpdateRequest("+254733000333", null, "Moi Avenue 12", null, null,
                null, null, null, null, null, null, null, "Peanuts", null, null, null, null, null);
        Patient updated = patientService.updateProfile("PAT000111222", request);

        assertThat(updated.getPhone()).isEqualTo("+254733000333");
        assertThat(updated.getAddress()).isEqualTo("Moi Avenue 12");
        assertThat(updated.getCity()).isEqualTo("Nairobi");
        assertThat(updated.getFirstName()).isEqualTo("Brian");
        assertThat(updated.getIdNumber()).isEqualTo("30123456");
        assertThat(updated.getEmail()).isEqualTo("brian@example.com");
        assertThat(updated.getAllergies()).extracting(Allergy::getAllergen).containsExactly("Peanuts");
    }

    @Test
    void ageFollowsTheHospitalClock() {
        Patient birthdayTomorrow = new Patient("Amani", "Otieno", LocalDate.of(2006, 6, 11), "amani@example.com");
        birthdayTomorrow.setPatientId("PAT000333444");
        when(patientRepository.findByPatientId("PAT000333444")).thenReturn(Optional.of(birthdayTomorrow));

        Patient found = patientService.getByPatientId("PAT000333444");

        assertThat(found.getAge()).isEqualTo(17);
        assertThat(found.isMinor()).isTrue();
    }

    @Test
    void unknownPatientCodeIsNotFound() {
        when(patientRepository.findByPatientId("PAT404")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> patientService.getByPatientId("PAT404"))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessage("Patient not found");
    }

    @Test
    void forgotIdAnswersTheSameForUnknownEmails() {
        when(patientRepository.existsByEmail("nobody@example.com")).thenReturn(false);

        assertThat(patientService.forgotId("Nobody@example.com")).isEqualTo(PatientService.FORGOT_ID_MESSAGE);
    }
}
