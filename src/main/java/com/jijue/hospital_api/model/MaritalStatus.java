package com.jijue.hospital_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MaritalStatus {
    SINGLE("single"),
    MARRIED("married"),
    DIVORCED("divorced"),
    WIDOWED("widowed"),
    OTHER("other");

    private final String value;

    MaritalStatus(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static MaritalStatus fromValue(String value) {
        if (value != null) {
            for (MaritalStatus candidate : values()) {
                if (candidate.value.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid marital status: " + value);
    }
}
