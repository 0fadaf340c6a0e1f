package com.jijue.hospital_api.model;

import java.time.Instant;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document("labrequests")
public class LabRequest {
    @Id
    private String id;
    private String patient;
    @Indexed
    private String patientId;
    private String testType;
    private String reason;
    private Urgency urgency = Urgency.ROUTINE;
    private String notes;
    private LabRequestStatus status = LabRequestStatus.REQUESTED;
    private Instant requestedDate;
    private Instant completedDate;
    private String results;
    private Instant createdAt;
    private Instant updatedAt;

    public LabRequest() {}

    public LabRequest(String patientId, String testType) {
        this.patientId = patientId;
        this.testType = testType;
    }

    // Getters
    public String getId() { return id; }
    public String getPatient() { return patient; }
    public String getPatientId() { return patientId; }
    public String getTestType() { return testType; }
    public String getReason() { return reason; }
    public Urgency getUrgency() { return urgency; }
    public String getNotes() { return notes; }
    public LabRequestStatus getStatus() { return status; }
    public Instant getRequestedDate() { return requestedDate; }
    public Instant getCompletedDate() { return completedDate; }
    public String getResults() { return results; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setPatient(String patient) { this.patient = patient; }
    public void setPatientId(String patientId) { this.patientId = patientId; }
    public void setTestType(String testType) { this.testType = testType; }
    public void setReason(String reason) { this.reason = reason; }
    public void setUrgency(Urgency urgency) { this.urgency = urgency; }
    public void setNotes(String notes) { this.notes = notes; }
    public void setStatus(LabRequestStatus status) { this.status = status; }
    public void setRequestedDate(Instant requestedDate) { this.requestedDate = requestedDate; }
    public void setCompletedDate(Instant completedDate) { this.completedDate = completedDate; }
    public void setResults(String results) { this.results = results; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LabRequest that = (LabRequest) o;
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
