package com.jijue.hospital_api.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import com.fasterxml.jackson.annotation.JsonProperty;

@Document("patients")
public class Patient {
    @Id
    private String id;
    @Indexed(unique = true)
    private String patientId;

    private String firstName;
    private String lastName;
    private LocalDate dateOfBirth;
    private Gender gender;
    @Indexed(unique = true, sparse = true)
    private String idNumber;
    @Indexed(unique = true)
    private String email;
    private String phone;
    private String alternatePhone;
    private String address;
    private String city;
    private String postalCode;

    private BloodType bloodType = BloodType.UNKNOWN;
    private List<MedicalCondition> medicalHistory = new ArrayList<>();
    private List<Allergy> allergies = new ArrayList<>();
    private List<Medication> currentMedications = new ArrayList<>();
    private String allergiesText;
    private String conditionsText;
    private String medicationsText;
    private String familyHistory;
    private String surgicalHistory;

    private EmergencyContact emergencyContact;
    private PaymentMethod paymentMethod;
    private String insuranceProvider;
    private String policyNumber;

    private PatientStatus status = PatientStatus.ACTIVE;
    private MaritalStatus maritalStatus;
    private String nationality;
    private String occupation;
    private String preferredLanguage;
    private boolean termsAccepted;
    private boolean privacyAccepted;
    private boolean marketingConsent;

    private Instant registrationDate;
    private Instant lastLogin;
    private Instant createdAt;
    private Instant updatedAt;

    @Transient
    private Integer age;

    public Patient() {}

    public Patient(String firstName, String lastName, LocalDate dateOfBirth, String email) {
        this.firstName = firstName;
        this.lastName = lastName;
        this.dateOfBirth = dateOfBirth;
        this.email = email;
    }

    // Derived
    public String getFullName() {
        return Objects.toString(firstName, "") + " " + Objects.toString(lastName, "");
    }

    /** Age as of the last {@link #refreshAge(LocalDate)}; null until then. */
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public Integer getAge() {
        return age;
    }

    public void refreshAge(LocalDate today) {
        this.age = ageOn(today);
    }

    public Integer ageOn(LocalDate today) {
        if (dateOfBirth == null) {
            return null;
        }
        return Period.between(dateOfBirth, today).getYears();
    }

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public boolean isMinor() {
        return age != null && age < 18;
    }

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public List<MedicalCondition> getActiveConditions() {
        return medicalHistory.stream()
                .filter(c -> c.getStatus() == ConditionStatus.ACTIVE || c.getStatus() == ConditionStatus.CHRONIC)
                .toList();
    }

    /**
     * Normalizes contact fields and turns the free-text intake answers into
     * structured entries when the structured lists are still empty.
     */
    public void prepareForSave(LocalDate today) {
        if (email != null) {
            email = email.trim().toLowerCase();
        }
        if (firstName != null) {
            firstName = firstName.trim();
        }
        if (lastName != null) {
            lastName = lastName.trim();
        }
        if (bloodType == null) {
            bloodType = BloodType.UNKNOWN;
        }
        if (status == null) {
            status = PatientStatus.ACTIVE;
        }
        if (allergies.isEmpty()) {
            for (String allergen : splitList(allergiesText)) {
                allergies.add(new Allergy(allergen, AllergySeverity.MODERATE, "Not specified"));
            }
        }
        if (medicalHistory.isEmpty()) {
            for (String condition : splitList(conditionsText)) {
                medicalHistory.add(new MedicalCondition(condition, today, ConditionStatus.ACTIVE, null));
            }
        }
        if (currentMedications.isEmpty()) {
            for (String name : splitList(medicationsText)) {
                currentMedications.add(new Medication(name, "As prescribed", "Daily", today, null));
            }
        }
    }

    static List<String> splitList(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    // Getters
    public String getId() { return id; }
    public String getPatientId() { return patientId; }
    public String getFirstName() { return firstName; }
    public String getLastName() { return lastName; }
    public LocalDate getDateOfBirth() { return dateOfBirth; }
    public Gender getGender() { return gender; }
    public String getIdNumber() { return idNumber; }
    public String getEmail() { return email; }
    public String getPhone() { return phone; }
    public String getAlternatePhone() { return alternatePhone; }
    public String getAddress() { return address; }
    public String getCity() { return city; }
    public String getPostalCode() { return postalCode; }
    public BloodType getBloodType() { return bloodType; }
    public List<MedicalCondition> getMedicalHistory() { return medicalHistory; }
    public List<Allergy> getAllergies() { return allergies; }
    public List<Medication> getCurrentMedications() { return currentMedications; }
    public String getAllergiesText() { return allergiesText; }
    public String getConditionsText() { return conditionsText; }
    public String getMedicationsText() { return medicationsText; }
    public String getFamilyHistory() { return familyHistory; }
    public String getSurgicalHistory() { return surgicalHistory; }
    public EmergencyContact getEmergencyContact() { return emergencyContact; }
    public PaymentMethod getPaymentMethod() { return paymentMethod; }
    public String getInsuranceProvider() { return insuranceProvider; }
    public String getPolicyNumber() { return policyNumber; }
    public PatientStatus getStatus() { return status; }
    public MaritalStatus getMaritalStatus() { return maritalStatus; }
    public String getNationality() { return nationality; }
    public String getOccupation() { return occupation; }
    public String getPreferredLanguage() { return preferredLanguage; }
    public boolean isTermsAccepted() { return termsAccepted; }
    public boolean isPrivacyAccepted() { return privacyAccepted; }
    public boolean isMarketingConsent() { return marketingConsent; }
    public Instant getRegistrationDate() { return registrationDate; }
    public Instant getLastLogin() { return lastLogin; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setPatientId(String patientId) { this.patientId = patientId; }
    public void setFirstName(String firstName) { this.firstName = firstName; }
    public void setLastName(String lastName) { this.lastName = lastName; }
    public void setDateOfBirth(LocalDate dateOfBirth) { this.dateOfBirth = dateOfBirth; }
    public void setGender(Gender gender) { this.gender = gender; }
    public void setIdNumber(String idNumber) { this.idNumber = idNumber; }
    public void setEmail(String email) { this.email = email; }
    public void setPhone(String phone) { this.phone = phone; }
    public void setAlternatePhone(String alternatePhone) { this.alternatePhone = alternatePhone; }
    public void setAddress(String address) { this.address = address; }
    public void setCity(String city) { this.city = city; }
    public void setPostalCode(String postalCode) { this.postalCode = postalCode; }
    public void setBloodType(BloodType bloodType) { this.bloodType = bloodType; }
    public void setMedicalHistory(List<MedicalCondition> medicalHistory) { this.medicalHistory = medicalHistory != null ? medicalHistory : new ArrayList<>(); }
    public void setAllergies(List<Allergy> allergies) { this.allergies = allergies != null ? allergies : new ArrayList<>(); }
    public void setCurrentMedications(List<Medication> currentMedications) { this.currentMedications = currentMedications != null ? currentMedications : new ArrayList<>(); }
    public void setAllergiesText(String allergiesText) { this.allergiesText = allergiesText; }
    public void setConditionsText(String conditionsText) { this.conditionsText = conditionsText; }
    public void setMedicationsText(String medicationsText) { this.medicationsText = medicationsText; }
    public void setFamilyHistory(String familyHistory) { this.familyHistory = familyHistory; }
    public void setSurgicalHistory(String surgicalHistory) { this.surgicalHistory = surgicalHistory; }
    public void setEmergencyContact(EmergencyContact emergencyContact) { this.emergencyContact = emergencyContact; }
    public void setPaymentMethod(PaymentMethod paymentMethod) { this.paymentMethod = paymentMethod; }
    public void setInsuranceProvider(String insuranceProvider) { this.insuranceProvider = insuranceProvider; }
    public void setPolicyNumber(String policyNumber) { this.policyNumber = policyNumber; }
    public void setStatus(PatientStatus status) { this.status = status; }
    public void setMaritalStatus(MaritalStatus maritalStatus) { this.maritalStatus = maritalStatus; }
    public void setNationality(String nationality) { this.nationality = nationality; }
    public void setOccupation(String occupation) { this.occupation = occupation; }
    public void setPreferredLanguage(String preferredLanguage) { this.preferredLanguage = preferredLanguage; }
    public void setTermsAccepted(boolean termsAccepted) { this.termsAccepted = termsAccepted; }
    public void setPrivacyAccepted(boolean privacyAccepted) { this.privacyAccepted = privacyAccepted; }
    public void setMarketingConsent(boolean marketingConsent) { this.marketingConsent = marketingConsent; }
    public void setRegistrationDate(Instant registrationDate) { this.registrationDate = registrationDate; }
    public void setLastLogin(Instant lastLogin) { this.lastLogin = lastLogin; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Patient patient = (Patient) o;
        if (id == null || patient.id == null) {
            return false;
        }
        return Objects.equals(id, patient.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
