package com.jijue.hospital_api.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jijue.hospital_api.util.TimeOfDay;

@Document("doctors")
public class Doctor {
    @Id
    private String id;
    @Indexed(unique = true)
    private String doctorId;

    private String name;
    private Specialization specialization;
    @Indexed(unique = true)
    private String licenseNumber;
    private int yearsOfExperience;
    private List<Qualification> qualifications = new ArrayList<>();
    private String bio;
    private double consultationFee;

    private Availability availability = new Availability();
    @JsonProperty("isAvailable")
    private boolean available = true;
    private Rating rating = new Rating();

    @Indexed(unique = true)
    private String email;
    private String phone;
    private String address;
    private String profileImage = "default-doctor.jpg";
    private List<String> languages = new ArrayList<>(List.of("English"));
    private String department;

    private DoctorStatus status = DoctorStatus.ACTIVE;
    private DoctorStatistics statistics = new DoctorStatistics();
    private DoctorPreferences preferences = new DoctorPreferences();
    private boolean verified;
    private Instant lastActive;
    private Instant createdAt;
    private Instant updatedAt;

    @Transient
    private String nextAvailable;

    // Only read on creation, to open a login account for the doctor
    @Transient
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String password;

    public Doctor() {}

    public Doctor(String name, Specialization specialization, String licenseNumber, String email) {
        this.name = name;
        this.specialization = specialization;
        this.licenseNumber = licenseNumber;
        this.email = email;
    }

    // Derived
    public String getSpecialtyDisplay() {
        return specialization == null ? null : specialization.getDisplayName();
    }

    public String getExperienceLevel() {
        if (yearsOfExperience >= 20) return "Senior Consultant";
        if (yearsOfExperience >= 10) return "Consultant";
        if (yearsOfExperience >= 5) return "Specialist";
        return "Junior Doctor";
    }

    public String getFormattedFee() {
        if (consultationFee == 0) {
            return "Free Consultation";
        }
        String pattern = consultationFee % 1 == 0 ? "KES %,.0f" : "KES %,.2f";
        return String.format(Locale.US, pattern, consultationFee);
    }

    public String getNextAvailable() { return nextAvailable; }

    public void refreshNextAvailable(LocalDateTime now) {
        this.nextAvailable = nextAvailableAt(now);
    }

    /**
     * Human readable hint for the earliest time the doctor can be seen, or
     * {@code null} when the doctor has switched availability off.
     */
    public String nextAvailableAt(LocalDateTime now) {
        if (!available) {
            return null;
        }
        int minutes = now.getHour() * 60 + now.getMinute();
        if (availability.worksOn(now.getDayOfWeek())) {
            if (minutes < TimeOfDay.toMinutes(availability.getStartTime())) {
                return "Today at " + availability.getStartTime();
            }
            if (availability.isDuringBreak(minutes)) {
                return "Today at " + availability.getBreakEnd();
            }
            if (minutes < TimeOfDay.toMinutes(availability.getEndTime())) {
                return "Available Now";
            }
        }
        for (int i = 1; i <= 7; i++) {
            DayOfWeek day = now.toLocalDate().plusDays(i).getDayOfWeek();
            if (availability.worksOn(day)) {
                return "Next " + day.getDisplayName(TextStyle.FULL, Locale.ENGLISH) + " at " + availability.getStartTime();
            }
        }
        return "Not Available";
    }

    public AvailabilityCheck checkAvailability(LocalDate date, String time) {
        if (!available || status != DoctorStatus.ACTIVE) {
            return AvailabilityCheck.closed("Doctor is not available");
        }
        if (!availability.worksOn(date.getDayOfWeek())) {
            return AvailabilityCheck.closed("Doctor does not work on this day");
        }
        int minutes = TimeOfDay.toMinutes(time);
        if (minutes < TimeOfDay.toMinutes(availability.getStartTime())
                || minutes >= TimeOfDay.toMinutes(availability.getEndTime())) {
            return AvailabilityCheck.closed("Outside working hours");
        }
        if (availability.isDuringBreak(minutes)) {
            return AvailabilityCheck.closed("During break time");
        }
        return AvailabilityCheck.open();
    }

    public List<TimeSlot> generateTimeSlots(LocalDate date) {
        if (!availability.worksOn(date.getDayOfWeek())) {
            return List.of();
        }
        return availability.slotStarts().stream().map(TimeSlot::of).toList();
    }

    public void addRating(int stars) {
        if (rating == null) {
            rating = new Rating();
        }
        rating.add(stars);
    }

    // Getters
    public String getId() { return id; }
    public String getDoctorId() { return doctorId; }
    public String getName() { return name; }
    public Specialization getSpecialization() { return specialization; }
    public String getLicenseNumber() { return licenseNumber; }
    public int getYearsOfExperience() { return yearsOfExperience; }
    public List<Qualification> getQualifications() { return qualifications; }
    public String getBio() { return bio; }
    public double getConsultationFee() { return consultationFee; }
    public Availability getAvailability() { return availability; }
    public boolean isAvailable() { return available; }
    public Rating getRating() { return rating; }
    public String getEmail() { return email; }
    public String getPhone() { return phone; }
    public String getAddress() { return address; }
    public String getProfileImage() { return profileImage; }
    public List<String> getLanguages() { return languages; }
    public String getDepartment() { return department; }
    public DoctorStatus getStatus() { return status; }
    public DoctorStatistics getStatistics() { return statistics; }
    public DoctorPreferences getPreferences() { return preferences; }
    public boolean isVerified() { return verified; }
    public Instant getLastActive() { return lastActive; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public String getPassword() { return password; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setDoctorId(String doctorId) { this.doctorId = doctorId; }
    public void setName(String name) { this.name = name; }
    public void setSpecialization(Specialization specialization) { this.specialization = specialization; }
    public void setLicenseNumber(String licenseNumber) { this.licenseNumber = licenseNumber; }
    public void setYearsOfExperience(int yearsOfExperience) { this.yearsOfExperience = yearsOfExperience; }
    public void setQualifications(List<Qualification> qualifications) { this.qualifications = qualifications != null ? qualifications : new ArrayList<>(); }
    public void setBio(String bio) { this.bio = bio; }
    public void setConsultationFee(double consultationFee) { this.consultationFee = consultationFee; }
    public void setAvailability(Availability availability) { this.availability = availability != null ? availability : new Availability(); }
    public void setAvailable(boolean available) { this.available = available; }
    public void setRating(Rating rating) { this.rating = rating; }
    public void setEmail(String email) { this.email = email; }
    public void setPhone(String phone) { this.phone = phone; }
    public void setAddress(String address) { this.address = address; }
    public void setProfileImage(String profileImage) { this.profileImage = profileImage; }
    public void setLanguages(List<String> languages) { this.languages = languages; }
    public void setDepartment(String department) { this.department = department; }
    public void setStatus(DoctorStatus status) { this.status = status; }
    public void setStatistics(DoctorStatistics statistics) { this.statistics = statistics; }
    public void setPreferences(DoctorPreferences preferences) { this.preferences = preferences; }
    public void setVerified(boolean verified) { this.verified = verified; }
    public void setLastActive(Instant lastActive) { this.lastActive = lastActive; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public void setPassword(String password) { this.password = password; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Doctor doctor = (Doctor) o;
        if (id == null || doctor.id == null) {
            return false;
        }
        return Objects.equals(id, doctor.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
