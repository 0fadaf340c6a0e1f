package com.jijue.hospital_api.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.dto.PatientRegistrationRequest;
import com.jijue.hospital_api.dto.PatientUpdateRequest;
import com.jijue.hospital_api.dto.ProfileUpdateRequest;
import com.jijue.hospital_api.model.BloodType;
import com.jijue.hospital_api.model.EmergencyContact;
import com.jijue.hospital_api.model.Gender;
import com.jijue.hospital_api.model.MaritalStatus;
import com.jijue.hospital_api.model.Patient;
import com.jijue.hospital_api.model.PatientStatus;
import com.jijue.hospital_api.model.PaymentMethod;
import com.jijue.hospital_api.repository.PatientRepository;
import com.jijue.hospital_api.util.BusinessIds;

@Service
public class PatientService {

    private static final Logger logger = LoggerFactory.getLogger(PatientService.class);

    static final String DUPLICATE = "Patient with this email or ID number already exists";
    public static final String FORGOT_ID_MESSAGE =
            "If an account exists with this email, you will receive your patient ID shortly.";

    private final PatientRepository patientRepository;
    private final Clock clock;

    public PatientService(PatientRepository patientRepository, Clock clock) {
        this.patientRepository = patientRepository;
        this.clock = clock;
    }

    public List<Patient> getAllPatients() {
        List<Patient> patients = patientRepository.findAll(Sort.by(Sort.Direction.DESC, "createdAt"));
        patients.forEach(this::refresh);
        return patients;
    }

    public Patient getPatientById(String id) {
        return refresh(patientRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Patient not found")));
    }

    public Patient getByPatientId(String patientId) {
        return refresh(patientRepository.findByPatientId(patientId)
                .orElseThrow(() -> new NoSuchElementException("Patient not found")));
    }

    public Patient createPatient(Patient patient) {
        if (UserService.isBlank(patient.getFirstName()) || UserService.isBlank(patient.getLastName())
                || UserService.isBlank(patient.getEmail())) {
            throw new IllegalArgumentException("First name, last name and email are required");
        }
        patient.setId(null);
        patient.prepareForSave(LocalDate.now(clock));
        ensureUnique(patient.getEmail(), patient.getIdNumber());

        Instant now = clock.instant();
        patient.setPatientId(BusinessIds.patientId(clock.millis()));
        patient.setRegistrationDate(now);
        patient.setCreatedAt(now);
        patient.setUpdatedAt(now);
        Patient saved = patientRepository.save(patient);
        logger.info("Patient {} created", saved.getPatientId());
        return refresh(saved);
    }

    /**
     * Merges the fields present in {@code update}. Identity and account fields are
     * applied for administrators only and ignored, with a warning, for anyone else.
     */
    public Patient updatePatient(String id, PatientUpdateRequest update, boolean admin) {
        Patient existing = patientRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Patient not found"));

        if (update.touchesAdministrativeFields() && !admin) {
            logger.warn("Ignoring identity fields in non-admin update of patient {}", existing.getPatientId());
        } else if (admin) {
            if (!UserService.isBlank(update.firstName())) existing.setFirstName(update.firstName().trim());
            if (!UserService.isBlank(update.lastName())) existing.setLastName(update.lastName().trim());
            if (update.dateOfBirth() != null) {
                if (update.dateOfBirth().isAfter(LocalDate.now(clock))) {
                    throw new IllegalArgumentException("Date of birth cannot be in the future");
                }
                existing.setDateOfBirth(update.dateOfBirth());
            }
            if (update.gender() != null) existing.setGender(Gender.fromValue(update.gender()));
            if (!UserService.isBlank(update.email())) {
                String email = UserService.normalizeEmail(update.email());
                if (!email.equals(existing.getEmail()) && patientRepository.existsByEmail(email)) {
                    throw new IllegalArgumentException(DUPLICATE);
                }
                existing.setEmail(email);
            }
            if (!UserService.isBlank(update.idNumber())) {
                String idNumber = update.idNumber().trim();
                if (!idNumber.equals(existing.getIdNumber()) && patientRepository.existsByIdNumber(idNumber)) {
                    throw new IllegalArgumentException(DUPLICATE);
                }
                existing.setIdNumber(idNumber);
            }
            if (update.bloodType() != null) existing.setBloodType(BloodType.normalize(update.bloodType()));
            if (update.nationality() != null) existing.setNationality(update.nationality());
            if (update.status() != null) existing.setStatus(PatientStatus.fromValue(update.status()));
        }
        applyProfile(existing, update.profile());

        existing.prepareForSave(LocalDate.now(clock));
        existing.setUpdatedAt(clock.instant());
        logger.info("Updating patient {}", existing.getPatientId());
        return refresh(patientRepository.save(existing));
    }

    public void deletePatient(String id) {
        Patient patient = getPatientById(id);
        patientRepository.delete(patient);
        logger.warn("Patient {} deleted", patient.getPatientId());
    }

    /**
     * Intake-form registration. Enumerated answers are parsed here, the free-text
     * medical history is structured by {@link Patient#prepareForSave(LocalDate)}.
     */
    public Patient register(PatientRegistrationRequest request) {
        List<String> missing = new ArrayList<>();
        require(missing, "firstName", request.firstName());
        require(missing, "lastName", request.lastName());
        if (request.dateOfBirth() == null) {
            missing.add("dateOfBirth");
        }
        require(missing, "gender", request.gender());
        require(missing, "idNumber", request.idNumber());
        require(missing, "email", request.email());
        require(missing, "phone", request.phone());
        require(missing, "address", request.address());
        require(missing, "city", request.city());
        if (!missing.isEmpty()) {
            logger.warn("Registration rejected, missing fields {}", missing);
            throw new IllegalArgumentException("Missing required fields: " + String.join(", ", missing));
        }
        if (request.dateOfBirth().isAfter(LocalDate.now(clock))) {
            throw new IllegalArgumentException("Date of birth cannot be in the future");
        }

        Patient patient = new Patient(request.firstName(), request.lastName(), request.dateOfBirth(), request.email());
        patient.setGender(Gender.fromValue(request.gender()));
        patient.setIdNumber(request.idNumber().trim());
        patient.setPhone(request.phone().trim());
        patient.setAlternatePhone(request.alternatePhone());
        patient.setAddress(request.address());
        patient.setCity(request.city());
        patient.setPostalCode(request.postalCode());
        patient.setBloodType(BloodType.normalize(request.bloodType()));
        patient.setAllergiesText(request.allergies());
        patient.setConditionsText(request.conditions());
        patient.setMedicationsText(request.medications());
        patient.setFamilyHistory(request.familyHistory());
        patient.setSurgicalHistory(request.surgicalHistory());
        if (!UserService.isBlank(request.emergencyContactName()) || !UserService.isBlank(request.emergencyContactPhone())) {
            patient.setEmergencyContact(new EmergencyContact(request.emergencyContactName(),
                    request.emergencyContactPhone(), request.emergencyContactRelationship()));
        }
        if (!UserService.isBlank(request.paymentMethod())) {
            patient.setPaymentMethod(PaymentMethod.fromValue(request.paymentMethod()));
        }
        patient.setInsuranceProvider(request.insuranceProvider());
        patient.setPolicyNumber(request.policyNumber());
        if (!UserService.isBlank(request.maritalStatus())) {
            patient.setMaritalStatus(MaritalStatus.fromValue(request.maritalStatus()));
        }
        patient.setNationality(request.nationality());
        patient.setOccupation(request.occupation());
        patient.setPreferredLanguage(request.preferredLanguage());
        patient.setTermsAccepted(request.termsAccepted());
        patient.setPrivacyAccepted(request.privacyAccepted());
        patient.setMarketingConsent(request.marketingConsent());

        logger.info("Registering patient {} through the intake form", request.email());
        return createPatient(patient);
    }

    public String forgotId(String email) {
        if (UserService.isBlank(email)) {
            throw new IllegalArgumentException("Email is required");
        }
        // No mail transport: the lookup only feeds the log.
        boolean known = patientRepository.existsByEmail(UserService.normalizeEmail(email));
        logger.info("Patient ID reminder requested for {} (known: {})", email, known);
        return FORGOT_ID_MESSAGE;
    }

    public Patient updateProfile(String patientId, ProfileUpdateRequest update) {
        Patient patient = patientRepository.findByPatientId(patientId)
                .orElseThrow(() -> new NoSuchElementException("Patient not found"));
        applyProfile(patient, update);
        patient.prepareForSave(LocalDate.now(clock));
        patient.setUpdatedAt(clock.instant());
        logger.info("Profile of patient {} updated", patientId);
        return refresh(patientRepository.save(patient));
    }

    private static void applyProfile(Patient patient, ProfileUpdateRequest update) {
        if (update.phone() != null) patient.setPhone(update.phone().trim());
        if (update.alternatePhone() != null) patient.setAlternatePhone(update.alternatePhone());
        if (update.address() != null) patient.setAddress(update.address());
        if (update.city() != null) patient.setCity(update.city());
        if (update.postalCode() != null) patient.setPostalCode(update.postalCode());
        if (update.emergencyContact() != null) patient.setEmergencyContact(update.emergencyContact());
        if (update.paymentMethod() != null) patient.setPaymentMethod(PaymentMethod.fromValue(update.paymentMethod()));
        if (update.insuranceProvider() != null) patient.setInsuranceProvider(update.insuranceProvider());
        if (update.policyNumber() != null) patient.setPolicyNumber(update.policyNumber());
        if (update.maritalStatus() != null) patient.setMaritalStatus(MaritalStatus.fromValue(update.maritalStatus()));
        if (update.occupation() != null) patient.setOccupation(update.occupation());
        if (update.preferredLanguage() != null) patient.setPreferredLanguage(update.preferredLanguage());
        if (update.allergies() != null) patient.setAllergiesText(update.allergies());
        if (update.conditions() != null) patient.setConditionsText(update.conditions());
        if (update.medications() != null) patient.setMedicationsText(update.medications());
        if (update.familyHistory() != null) patient.setFamilyHistory(update.familyHistory());
        if (update.surgicalHistory() != null) patient.setSurgicalHistory(update.surgicalHistory());
        if (update.marketingConsent() != null) patient.setMarketingConsent(update.marketingConsent());
    }

    private Patient refresh(Patient patient) {
        patient.refreshAge(LocalDate.now(clock));
        return patient;
    }

    private void ensureUnique(String email, String idNumber) {
        boolean duplicate = patientRepository.existsByEmail(email)
                || (idNumber != null && patientRepository.existsByIdNumber(idNumber));
        if (duplicate) {
            logger.warn("Duplicate patient rejected: {}", email);
            throw new IllegalArgumentException(DUPLICATE);
        }
    }

    private static void require(List<String> missing, String field, String value) {
        if (UserService.isBlank(value)) {
            missing.add(field);
        }
    }
}
