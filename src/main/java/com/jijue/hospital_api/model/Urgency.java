package com.jijue.hospital_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Urgency {
    ROUTINE("routine"),
    URGENT("urgent"),
    EMERGENCY("emergency");

    private final String value;

    Urgency(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static Urgency fromValue(String value) {
        if (value != null) {
            for (Urgency candidate : values()) {
                if (candidate.value.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid urgency: " + value);
    }
}
