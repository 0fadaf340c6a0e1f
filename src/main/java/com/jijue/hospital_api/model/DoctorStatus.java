package com.jijue.hospital_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DoctorStatus {
    ACTIVE("active"),
    INACTIVE("inactive"),
    ON_LEAVE("on-leave"),
    SUSPENDED("suspended");

    private final String value;

    DoctorStatus(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static DoctorStatus fromValue(String value) {
        if (value != null) {
            for (DoctorStatus candidate : values()) {
                if (candidate.value.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid doctor status: " + value);
    }
}
