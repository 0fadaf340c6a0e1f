package com.jijue.hospital_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SubmissionStatus {
    NEW("new"),
    READ("read"),
    REPLIED("replied"),
    CLOSED("closed");

    private final String value;

    SubmissionStatus(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static SubmissionStatus fromValue(String value) {
        if (value != null) {
            for (SubmissionStatus candidate : values()) {
                if (candidate.value.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid submission status: " + value);
    }
}
