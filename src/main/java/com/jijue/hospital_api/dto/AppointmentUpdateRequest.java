package com.jijue.hospital_api.dto;

import java.time.LocalDate;

import com.jijue.hospital_api.model.FollowUp;

public record AppointmentUpdateRequest(
        LocalDate appointmentDate,
        String appointmentTime,
        Integer duration,
        String type,
        String consultationType,
        String reason,
        String symptoms,
        String diagnosis,
        String priority,
        String status,
        String notes,
        String doctorNotes,
        String nurseNotes,
        FollowUp followUp) {
}
