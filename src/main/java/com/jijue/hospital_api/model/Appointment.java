package com.jijue.hospital_api.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jijue.hospital_api.util.TimeOfDay;

@Document("appointments")
@CompoundIndex(name = "doctor_date", def = "{'doctor': 1, 'appointmentDate': 1}")
public class Appointment {

    public static final int DEFAULT_DURATION = 30;

    @Id
    private String id;
    @Indexed(unique = true)
    private String appointmentId;

    private String patient;
    @Indexed
    private String patientId;
    private String doctor;
    private String doctorId;
    private String department;

    private LocalDate appointmentDate;
    private String appointmentTime;
    private Integer duration = DEFAULT_DURATION;
    private AppointmentType type = AppointmentType.CONSULTATION;
    private ConsultationType consultationType = ConsultationType.IN_PERSON;
    private String reason;
    private String symptoms;
    private String diagnosis;
    private Priority priority = Priority.MEDIUM;
    private List<PrescriptionItem> prescription = new ArrayList<>();
    private AppointmentStatus status = AppointmentStatus.SCHEDULED;

    private FollowUp followUp;
    private String notes;
    private String doctorNotes;
    private String nurseNotes;
    private VitalSigns vitalSigns;
    private List<LabTest> labTests = new ArrayList<>();
    private List<Referral> referrals = new ArrayList<>();
    private Cancellation cancellation;

    private Instant createdAt;
    private Instant updatedAt;

    @Transient
    private Boolean upcoming;
    @Transient
    private Boolean past;

    public Appointment() {}

    public Appointment(String doctor, LocalDate appointmentDate, String appointmentTime, Integer duration) {
        this.doctor = doctor;
        this.appointmentDate = appointmentDate;
        this.appointmentTime = appointmentTime;
        this.duration = duration;
    }

    public void prepareForSave() {
        if (appointmentTime != null) {
            appointmentTime = TimeOfDay.normalize(appointmentTime);
        }
        if (duration == null) {
            duration = DEFAULT_DURATION;
        }
        if (vitalSigns != null) {
            vitalSigns.recomputeBmi();
        }
    }

    public int startMinutes() {
        return TimeOfDay.toMinutes(appointmentTime);
    }

    public int endMinutes() {
        return startMinutes() + effectiveDuration();
    }

    public int effectiveDuration() {
        return duration != null ? duration : DEFAULT_DURATION;
    }

    /** Half-open interval test: [start, end) against this appointment's own slot. */
    public boolean overlaps(int start, int end) {
        return start < endMinutes() && end > startMinutes();
    }

    public double getDurationHours() {
        return effectiveDuration() / 60.0;
    }

    public LocalDateTime startsAt() {
        return LocalDateTime.of(appointmentDate, LocalTime.MIN).plusMinutes(startMinutes());
    }

    public boolean isUpcomingAt(LocalDateTime now) {
        return startsAt().isAfter(now) && AppointmentStatus.UPCOMING.contains(status);
    }

    public boolean isPastAt(LocalDateTime now) {
        return startsAt().isBefore(now);
    }

    /** Recomputes the upcoming/past flags sent to clients. Left unset while date or time is missing. */
    public void refreshTiming(LocalDateTime now) {
        if (appointmentDate == null || appointmentTime == null) {
            upcoming = null;
            past = null;
            return;
        }
        upcoming = isUpcomingAt(now);
        past = isPastAt(now);
    }

    @JsonProperty(value = "isUpcoming", access = JsonProperty.Access.READ_ONLY)
    public Boolean getUpcoming() { return upcoming; }

    @JsonProperty(value = "isPast", access = JsonProperty.Access.READ_ONLY)
    public Boolean getPast() { return past; }

    // Getters
    public String getId() { return id; }
    public String getAppointmentId() { return appointmentId; }
    public String getPatient() { return patient; }
    public String getPatientId() { return patientId; }
    public String getDoctor() { return doctor; }
    public String getDoctorId() { return doctorId; }
    public String getDepartment() { return department; }
    public LocalDate getAppointmentDate() { return appointmentDate; }
    public String getAppointmentTime() { return appointmentTime; }
    public Integer getDuration() { return duration; }
    public AppointmentType getType() { return type; }
    public ConsultationType getConsultationType() { return consultationType; }
    public String getReason() { return reason; }
    public String getSymptoms() { return symptoms; }
    public String getDiagnosis() { return diagnosis; }
    public Priority getPriority() { return priority; }
    public List<PrescriptionItem> getPrescription() { return prescription; }
    public AppointmentStatus getStatus() { return status; }
    public FollowUp getFollowUp() { return followUp; }
    public String getNotes() { return notes; }
    public String getDoctorNotes() { return doctorNotes; }
    public String getNurseNotes() { return nurseNotes; }
    public VitalSigns getVitalSigns() { return vitalSigns; }
    public List<LabTest> getLabTests() { return labTests; }
    public List<Referral> getReferrals() { return referrals; }
    public Cancellation getCancellation() { return cancellation; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setAppointmentId(String appointmentId) { this.appointmentId = appointmentId; }
    public void setPatient(String patient) { this.patient = patient; }
    public void setPatientId(String patientId) { this.patientId = patientId; }
    public void setDoctor(String doctor) { this.doctor = doctor; }
    public void setDoctorId(String doctorId) { this.doctorId = doctorId; }
    public void setDepartment(String department) { this.department = department; }
    public void setAppointmentDate(LocalDate appointmentDate) { this.appointmentDate = appointmentDate; }
    public void setAppointmentTime(String appointmentTime) { this.appointmentTime = appointmentTime; }
    public void setDuration(Integer duration) { this.duration = duration; }
    public void setType(AppointmentType type) { this.type = type; }
    public void setConsultationType(ConsultationType consultationType) { this.consultationType = consultationType; }
    public void setReason(String reason) { this.reason = reason; }
    public void setSymptoms(String symptoms) { this.symptoms = symptoms; }
    public void setDiagnosis(String diagnosis) { this.diagnosis = diagnosis; }
    public void setPriority(Priority priority) { this.priority = priority; }
    public void setPrescription(List<PrescriptionItem> prescription) { this.prescription = prescription != null ? prescription : new ArrayList<>(); }
    public void setStatus(AppointmentStatus status) { this.status = status; }
    public void setFollowUp(FollowUp followUp) { this.followUp = followUp; }
    public void setNotes(String notes) { this.notes = notes; }
    public void setDoctorNotes(String doctorNotes) { this.doctorNotes = doctorNotes; }
    public void setNurseNotes(String nurseNotes) { this.nurseNotes = nurseNotes; }
    public void setVitalSigns(VitalSigns vitalSigns) { this.vitalSigns = vitalSigns; }
    public void setLabTests(List<LabTest> labTests) { this.labTests = labTests != null ? labTests : new ArrayList<>(); }
    public void setReferrals(List<Referral> referrals) { this.referrals = referrals != null ? referrals : new ArrayList<>(); }
    public void setCancellation(Cancellation cancellation) { this.cancellation = cancellation; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Appointment that = (Appointment) o;
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
