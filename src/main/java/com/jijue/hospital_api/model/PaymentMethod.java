package com.jijue.hospital_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentMethod {
    INSURANCE("insurance"),
    SHA("sha"),
    CASH("cash"),
    BANK("bank"),
    MOBILE("mobile"),
    CREDIT("credit"),
    DEBIT("debit"),
    OTHER("other");

    private final String value;

    PaymentMethod(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static PaymentMethod fromValue(String value) {
        if (value != null) {
            for (PaymentMethod candidate : values()) {
                if (candidate.value.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid payment method: " + value);
    }
}
