package com.jijue.hospital_api.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document("medicalrecords")
public class MedicalRecord {
    @Id
    private String id;
    private String patient;
    @Indexed
    private String patientId;
    private String doctor;
    private LocalDate visitDate;
    private String diagnosis;
    private String treatment;
    private List<String> medications = new ArrayList<>();
    private String notes;
    private VitalSigns vitalSigns;
    private List<String> attachments = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;

    public MedicalRecord() {}

    // Getters
    public String getId() { return id; }
    public String getPatient() { return patient; }
    public String getPatientId() { return patientId; }
    public String getDoctor() { return doctor; }
    public LocalDate getVisitDate() { return visitDate; }
    public String getDiagnosis() { return diagnosis; }
    public String getTreatment() { return treatment; }
    public List<String> getMedications() { return medications; }
    public String getNotes() { return notes; }
    public VitalSigns getVitalSigns() { return vitalSigns; }
    public List<String> getAttachments() { return attachments; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setPatient(String patient) { this.patient = patient; }
    public void setPatientId(String patientId) { this.patientId = patientId; }
    public void setDoctor(String doctor) { this.doctor = doctor; }
    public void setVisitDate(LocalDate visitDate) { this.visitDate = visitDate; }
    public void setDiagnosis(String diagnosis) { this.diagnosis = diagnosis; }
    public void setTreatment(String treatment) { this.treatment = treatment; }
    public void setMedications(List<String> medications) { this.medications = medications != null ? medications : new ArrayList<>(); }
    public void setNotes(String notes) { this.notes = notes; }
    public void setVitalSigns(VitalSigns vitalSigns) { this.vitalSigns = vitalSigns; }
    public void setAttachments(List<String> attachments) { this.attachments = attachments != null ? attachments : new ArrayList<>(); }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MedicalRecord that = (MedicalRecord) o;
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
