package com.jijue.hospital_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Wing {
    EAST("east"),
    WEST("west"),
    NORTH("north"),
    SOUTH("south"),
    CENTRAL("central");

    private final String value;

    Wing(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static Wing fromValue(String value) {
        if (value != null) {
            for (Wing candidate : values()) {
                if (candidate.value.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid wing: " + value);
    }
}
