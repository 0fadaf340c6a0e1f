package com.jijue.hospital_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DepartmentStatus {
    ACTIVE("active"),
    INACTIVE("inactive"),
    UNDER_MAINTENANCE("under-maintenance"),
    CLOSED("closed");

    private final String value;

    DepartmentStatus(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static DepartmentStatus fromValue(String value) {
        if (value != null) {
            for (DepartmentStatus candidate : values()) {
                if (candidate.value.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid department status: " + value);
    }
}
