package com.jijue.hospital_api.model;

import com.jijue.hospital_api.util.TimeOfDay;

/** A bookable start time: {@code time} in "HH:mm", {@code display} in 12-hour form. */
public record TimeSlot(String time, String display) {

    public static TimeSlot of(String time) {
        return new TimeSlot(time, TimeOfDay.toDisplay(time));
    }
}
