package com.jijue.hospital_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Specialization {
    CARDIOLOGY("cardiology", "Cardiology"),
    NEUROLOGY("neurology", "Neurology"),
    PEDIATRICS("pediatrics", "Pediatrics"),
    ORTHOPEDICS("orthopedics", "Orthopedics"),
    OPHTHALMOLOGY("ophthalmology", "Ophthalmology"),
    ENT("ent", "ENT (Ear, Nose & Throat)"),
    PULMONOLOGY("pulmonology", "Pulmonology"),
    ONCOLOGY("oncology", "Oncology"),
    HEMATOLOGY("hematology", "Hematology"),
    GASTROENTEROLOGY("gastroenterology", "Gastroenterology"),
    DERMATOLOGY("dermatology", "Dermatology"),
    DENTISTRY("dentistry", "Dentistry"),
    PSYCHIATRY("psychiatry", "Psychiatry"),
    OBGYN("obgyn", "Obstetrics & Gynecology"),
    UROLOGY("urology", "Urology"),
    PHYSICAL_THERAPY("physical-therapy", "Physical Therapy"),
    GENERAL_MEDICINE("general-medicine", "General Medicine"),
    SURGERY("surgery", "Surgery"),
    EMERGENCY_MEDICINE("emergency-medicine", "Emergency Medicine");

    private final String value;
    private final String displayName;

    Specialization(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String getValue() { return value; }

    public String getDisplayName() { return displayName; }

    @JsonCreator
    public static Specialization fromValue(String value) {
        if (value != null) {
            String candidate = value.trim().toLowerCase().replace(' ', '-');
            for (Specialization specialization : values()) {
                if (specialization.value.equals(candidate)) {
                    return specialization;
                }
            }
        }
        throw new IllegalArgumentException("Invalid specialization: " + value);
    }
}
