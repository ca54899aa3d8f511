package com.rentnest.tm30.domain;

/**
 * Why a caller was allowed to touch a booking
 */
public enum AccessGrant {
    OWNER,
    OPERATOR,
    INTERNAL_KEY;

    /**
     * Only operators may make administrative status corrections.
     */
    public boolean isAdministrative() {
        return this == OPERATOR;
    }
}
