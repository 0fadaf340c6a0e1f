package com.jijue.hospital_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionStatus {
    ACTIVE("active"),
    RESOLVED("resolved"),
    CHRONIC("chronic");

    private final String value;

    ConditionStatus(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static ConditionStatus fromValue(String value) {
        if (value != null) {
            for (ConditionStatus candidate : values()) {
                if (candidate.value.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid condition status: " + value);
    }
}
