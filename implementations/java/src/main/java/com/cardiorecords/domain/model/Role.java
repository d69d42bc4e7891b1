package com.cardiorecords.domain.model;

/**
 * Closed set of account roles.
 *
 * <p>Authorization is a membership check against this set; there is no open
 * permission model.
 */
public enum Role {
    USER,
    CLINICIAN,
    ADMIN;

    public String authority() {
        return "ROLE_" + name();
    }
}
