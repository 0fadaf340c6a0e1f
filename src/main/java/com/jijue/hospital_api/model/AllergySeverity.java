package com.jijue.hospital_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AllergySeverity {
    MILD("mild"),
    MODERATE("moderate"),
    SEVERE("severe");

    private final String value;

    AllergySeverity(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static AllergySeverity fromValue(String value) {
        if (value != null) {
            for (AllergySeverity candidate : values()) {
                if (candidate.value.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid allergy severity: " + value);
    }
}
