package com.jijue.hospital_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AppointmentType {
    CONSULTATION("consultation"),
    FOLLOW_UP("follow-up"),
    CHECKUP("checkup"),
    EMERGENCY("emergency"),
    SURGERY("surgery"),
    THERAPY("therapy");

    private final String value;

    AppointmentType(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static AppointmentType fromValue(String value) {
        if (value != null) {
            for (AppointmentType candidate : values()) {
                if (candidate.value.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid appointment type: " + value);
    }
}
