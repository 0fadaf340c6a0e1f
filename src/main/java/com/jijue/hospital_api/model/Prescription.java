package com.jijue.hospital_api.model;

import java.time.Instant;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document("prescriptions")
public class Prescription {
    @Id
    private String id;
    private String patient;
    @Indexed
    private String patientId;
    private String doctor;
    private String medication;
    private String dosage;
    private String frequency;
    private String instructions;
    private String reason;
    private Instant prescribedDate;
    private Instant requestedDate;
    private PrescriptionStatus status = PrescriptionStatus.REQUESTED;
    private int refillsRemaining;
    private Instant lastRefillDate;
    private Instant createdAt;
    private Instant updatedAt;

    public Prescription() {}

    public Prescription(String patientId, String medication, PrescriptionStatus status) {
        this.patientId = patientId;
        this.medication = medication;
        this.status = status;
    }

    // Getters
    public String getId() { return id; }
    public String getPatient() { return patient; }
    public String getPatientId() { return patientId; }
    public String getDoctor() { return doctor; }
    public String getMedication() { return medication; }
    public String getDosage() { return dosage; }
    public String getFrequency() { return frequency; }
    public String getInstructions() { return instructions; }
    public String getReason() { return reason; }
    public Instant getPrescribedDate() { return prescribedDate; }
    public Instant getRequestedDate() { return requestedDate; }
    public PrescriptionStatus getStatus() { return status; }
    public int getRefillsRemaining() { return refillsRemaining; }
    public Instant getLastRefillDate() { return lastRefillDate; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setPatient(String patient) { this.patient = patient; }
    public void setPatientId(String patientId) { this.patientId = patientId; }
    public void setDoctor(String doctor) { this.doctor = doctor; }
    public void setMedication(String medication) { this.medication = medication; }
    public void setDosage(String dosage) { this.dosage = dosage; }
    public void setFrequency(String frequency) { this.frequency = frequency; }
    public void setInstructions(String instructions) { this.instructions = instructions; }
    public void setReason(String reason) { this.reason = reason; }
    public void setPrescribedDate(Instant prescribedDate) { this.prescribedDate = prescribedDate; }
    public void setRequestedDate(Instant requestedDate) { this.requestedDate = requestedDate; }
    public void setStatus(PrescriptionStatus status) { this.status = status; }
    public void setRefillsRemaining(int refillsRemaining) { this.refillsRemaining = refillsRemaining; }
    public void setLastRefillDate(Instant lastRefillDate) { this.lastRefillDate = lastRefillDate; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Prescription that = (Prescription) o;
        if (id == null || that.id == null) {
            return false;
        }
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
