package com.jijue.hospital_api.dto;

import java.time.LocalDate;
import java.util.List;

import com.jijue.hospital_api.model.TimeSlot;

/**
 * Open slots of one doctor on one date, booked slots already removed.
 */
public record DaySchedule(
        String doctorId,
        String doctorName,
        LocalDate date,
        boolean isWorkingDay,
        WorkingHours workingHours,
        int slotDuration,
        int bookedSlots,
        List<TimeSlot> availableSlots) {

    public record WorkingHours(String start, String end, String breakStart, String breakEnd) {
    }
}
