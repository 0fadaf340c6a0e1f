package com.jijue.hospital_api.exception;

import java.util.List;

import com.jijue.hospital_api.model.Appointment;

/**
 * Thrown when a booking would overlap an appointment the doctor already holds.
 */
public class AppointmentConflictException extends RuntimeException {

    private final transient List<Appointment> conflicts;

    public AppointmentConflictException(String message, List<Appointment> conflicts) {
        super(message);
        this.conflicts = List.copyOf(conflicts);
    }

    public List<Appointment> getConflicts() {
        return conflicts;
    }
}
