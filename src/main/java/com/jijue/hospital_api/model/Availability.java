package com.jijue.hospital_api.model;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.jijue.hospital_api.util.TimeOfDay;

import lombok.Getter;
import lombok.Setter;

/**
 * Weekly working pattern of a doctor. Days are lowercase English names
 * ("monday"), times are "HH:mm". The break is optional.
 */
@Getter
@Setter
public class Availability {

    public static final Set<Integer> SLOT_DURATIONS = Set.of(15, 20, 30, 45, 60);

    private List<String> workingDays = new ArrayList<>(List.of("monday", "tuesday", "wednesday", "thursday", "friday"));
    private String startTime = "09:00";
    private String endTime = "17:00";
    private String breakStart = "13:00";
    private String breakEnd = "14:00";
    private int slotDuration = 30;

    public boolean worksOn(DayOfWeek day) {
        return workingDays != null && workingDays.contains(day.name().toLowerCase());
    }

    public boolean hasBreak() {
        return breakStart != null && breakEnd != null;
    }

    public boolean isDuringBreak(int minutes) {
        return hasBreak() && minutes >= TimeOfDay.toMinutes(breakStart) && minutes < TimeOfDay.toMinutes(breakEnd);
    }

    /**
     * Start times from the start of the day up to the last slot that still ends
     * by {@code endTime}. A cursor landing inside the break jumps to the end of it.
     */
    public List<String> slotStarts() {
        List<String> slots = new ArrayList<>();
        int current = TimeOfDay.toMinutes(startTime);
        int end = TimeOfDay.toMinutes(endTime);
        while (current + slotDuration <= end) {
            if (isDuringBreak(current)) {
                current = TimeOfDay.toMinutes(breakEnd);
                continue;
            }
            slots.add(TimeOfDay.fromMinutes(current));
            current += slotDuration;
        }
        return slots;
    }

    public void normalizeAndValidate() {
        if (workingDays != null) {
            List<String> days = new ArrayList<>();
            for (String day : workingDays) {
                String normalized = day == null ? "" : day.trim().toLowerCase();
                try {
                    DayOfWeek.valueOf(normalized.toUpperCase());
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid working day: " + day);
                }
                if (!days.contains(normalized)) {
                    days.add(normalized);
                }
            }
            workingDays = days;
        }
        startTime = TimeOfDay.normalize(startTime);
        endTime = TimeOfDay.normalize(endTime);
        if (TimeOfDay.toMinutes(startTime) >= TimeOfDay.toMinutes(endTime)) {
            throw new IllegalArgumentException("Start time must be before end time");
        }
        if (breakStart != null || breakEnd != null) {
            if (breakStart == null || breakEnd == null) {
                throw new IllegalArgumentException("Break start and end must be provided together");
            }
            breakStart = TimeOfDay.normalize(breakStart);
            breakEnd = TimeOfDay.normalize(breakEnd);
            if (TimeOfDay.toMinutes(breakStart) >= TimeOfDay.toMinutes(breakEnd)) {
                throw new IllegalArgumentException("Break start must be before break end");
            }
        }
        if (!SLOT_DURATIONS.contains(slotDuration)) {
            throw new IllegalArgumentException("Slot duration must be one of 15, 20, 30, 45 or 60 minutes");
        }
    }
}
