package com.campus.portal.entity;

/**
 * Event lifecycle.
 * UPCOMING -> ONGOING -> COMPLETED, and UPCOMING/ONGOING -> CANCELLED.
 * COMPLETED and CANCELLED are terminal; a status never regresses.
 */
public enum EventStatus {
    UPCOMING,
    ONGOING,
    COMPLETED,
    CANCELLED;

    public boolean canTransitionTo(EventStatus target) {
        return switch (this) {
            case UPCOMING -> target == ONGOING || target == COMPLETED || target == CANCELLED;
            case ONGOING -> target == COMPLETED || target == CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
