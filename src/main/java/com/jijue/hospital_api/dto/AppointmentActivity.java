package com.jijue.hospital_api.dto;

import java.time.LocalDate;

public record AppointmentActivity(
        String id,
        String appointmentId,
        String type,
        String consultationType,
        LocalDate date,
        String time,
        String status,
        String reason,
        DoctorBrief doctor) {
}
