package com.jijue.hospital_api.model;

/**
 * Account roles. Spring Security expects the "ROLE_" prefix on authorities,
 * the short label is what clients see in tokens and responses.
 */
public enum Role {
    ROLE_PATIENT,
    ROLE_DOCTOR,
    ROLE_ADMIN;

    public String label() {
        return name().substring("ROLE_".length()).toLowerCase();
    }
}
