package com.jijue.hospital_api.util;

import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the "HH:mm" wall-clock strings used by schedules and appointments.
 * All arithmetic is done in minutes since midnight.
 */
public final class TimeOfDay {

    public static final Pattern FORMAT = Pattern.compile("^([0-1]?[0-9]|2[0-3]):([0-5][0-9])$");

    private TimeOfDay() {
    }

    public static boolean isValid(String time) {
        return time != null && FORMAT.matcher(time.trim()).matches();
    }

    public static int toMinutes(String time) {
        if (time == null) {
            throw new IllegalArgumentException("Time is required");
        }
        Matcher matcher = FORMAT.matcher(time.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid time format: " + time + " (expected HH:mm)");
        }
        return Integer.parseInt(matcher.group(1)) * 60 + Integer.parseInt(matcher.group(2));
    }

    public static String fromMinutes(int minutes) {
        return String.format("%02d:%02d", minutes / 60, minutes % 60);
    }

    /** "9:05" becomes "09:05" so that stored times sort lexicographically. */
    public static String normalize(String time) {
        return fromMinutes(toMinutes(time));
    }

    public static String of(LocalTime time) {
        return fromMinutes(time.getHour() * 60 + time.getMinute());
    }

    /** 12-hour rendering, e.g. "13:30" becomes "1:30 PM" and "00:15" becomes "12:15 AM". */
    public static String toDisplay(String time) {
        int minutes = toMinutes(time);
        int hour = minutes / 60;
        String period = hour >= 12 ? "PM" : "AM";
        int displayHour = hour % 12 == 0 ? 12 : hour % 12;
        return String.format("%d:%02d %s", displayHour, minutes % 60, period);
    }
}
