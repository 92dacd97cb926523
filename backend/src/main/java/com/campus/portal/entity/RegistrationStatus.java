package com.campus.portal.entity;

public enum RegistrationStatus {
    REGISTERED,
    ATTENDED,
    CANCELLED;

    /** Registered and attended rows hold a seat. */
    public boolean isActive() {
        return this != CANCELLED;
    }
}
