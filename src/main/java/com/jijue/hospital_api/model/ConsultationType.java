package com.jijue.hospital_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConsultationType {
    IN_PERSON("in-person"),
    ONLINE("online"),
    PHONE("phone");

    private final String value;

    ConsultationType(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static ConsultationType fromValue(String value) {
        if (value != null) {
            for (ConsultationType candidate : values()) {
                if (candidate.value.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid consultation type: " + value);
    }
}
