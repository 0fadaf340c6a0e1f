package com.jijue.hospital_api.dto;

import java.time.LocalDate;

/**
 * Query-string filters of the appointment list. {@code doctorId} may be the
 * database id or the DOC code.
 */
public record AppointmentSearchCriteria(
        String patientId,
        String doctorId,
        String status,
        LocalDate date,
        String type,
        int page,
        int limit,
        String sortBy,
        String sortOrder) {

    public AppointmentSearchCriteria forPatient(String patientCode) {
        return new AppointmentSearchCriteria(patientCode, doctorId, status, date, type, page, limit, sortBy, sortOrder);
    }
}
