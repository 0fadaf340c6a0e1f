package com.jijue.hospital_api.model;

import java.util.EnumSet;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AppointmentStatus {
    SCHEDULED("scheduled"),
    CONFIRMED("confirmed"),
    CHECKED_IN("checked-in"),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    CANCELLED("cancelled"),
    NO_SHOW("no-show"),
    RESCHEDULED("rescheduled");

    /** Statuses that still hold the doctor's time and therefore block other bookings. */
    public static final Set<AppointmentStatus> BLOCKING =
            EnumSet.of(SCHEDULED, CONFIRMED, CHECKED_IN, IN_PROGRESS, RESCHEDULED);

    /** Statuses an appointment starting later than now must have to count as upcoming. */
    public static final Set<AppointmentStatus> UPCOMING =
            EnumSet.of(SCHEDULED, CONFIRMED, CHECKED_IN);

    private final String value;

    AppointmentStatus(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    public boolean isFinal() {
        return this == COMPLETED || this == CANCELLED || this == NO_SHOW;
    }

    @JsonCreator
    public static AppointmentStatus fromValue(String value) {
        if (value != null) {
            for (AppointmentStatus status : values()) {
                if (status.value.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Invalid status: " + value);
    }
}
