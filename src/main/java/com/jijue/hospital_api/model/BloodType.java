package com.jijue.hospital_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BloodType {
    A_POSITIVE("A+"),
    A_NEGATIVE("A-"),
    B_POSITIVE("B+"),
    B_NEGATIVE("B-"),
    AB_POSITIVE("AB+"),
    AB_NEGATIVE("AB-"),
    O_POSITIVE("O+"),
    O_NEGATIVE("O-"),
    UNKNOWN("Unknown");

    private final String value;

    BloodType(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    /**
     * Lenient parse used for intake forms: anything that is not a recognised
     * group (case-insensitive, surrounding blanks ignored) becomes {@link #UNKNOWN}.
     */
    @JsonCreator
    public static BloodType normalize(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String candidate = value.trim().replace(" ", "");
        for (BloodType type : values()) {
            if (type.value.equalsIgnoreCase(candidate)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
