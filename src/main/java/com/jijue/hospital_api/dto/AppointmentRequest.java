package com.jijue.hospital_api.dto;

import java.time.LocalDate;

/**
 * Booking payload. {@code patientId} is the PAT code; {@code doctorId} may be
 * either the doctor's database id or the DOC code.
 */
public record AppointmentRequest(
        String patientId,
        String doctorId,
        LocalDate appointmentDate,
        String appointmentTime,
        Integer duration,
        String type,
        String consultationType,
        String reason,
        String symptoms,
        String priority,
        String notes) {

    public AppointmentRequest forPatient(String patientCode) {
        return new AppointmentRequest(patientCode, doctorId, appointmentDate, appointmentTime, duration,
                type, consultationType, reason, symptoms, priority, notes);
    }
}
