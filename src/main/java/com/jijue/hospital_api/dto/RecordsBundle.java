package com.jijue.hospital_api.dto;

import java.time.LocalDate;
import java.util.List;

import com.jijue.hospital_api.model.MedicalRecord;
import com.jijue.hospital_api.model.Prescription;

/**
 * Everything a patient can download about their own care.
 */
public record RecordsBundle(
        PatientCard patient,
        List<MedicalRecord> medicalRecords,
        List<VisitEntry> appointments,
        List<Prescription> prescriptions) {

    public record PatientCard(
            String name,
            String patientId,
            LocalDate dateOfBirth,
            String bloodType,
            String gender,
            String phone,
            String email) {
    }

    public record VisitEntry(
            String appointmentId,
            LocalDate date,
            String time,
            String doctor,
            String reason,
            String diagnosis,
            String notes,
            String status) {
    }
}
