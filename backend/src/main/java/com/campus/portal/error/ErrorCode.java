package com.campus.portal.error;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    // roster conflicts
    ALREADY_MEMBER("already-member", HttpStatus.CONFLICT),
    NOT_A_MEMBER("not-a-member", HttpStatus.CONFLICT),
    ALREADY_REGISTERED("already-registered", HttpStatus.CONFLICT),
    NOT_REGISTERED("not-registered", HttpStatus.CONFLICT),
    EVENT_FULL("event-full", HttpStatus.CONFLICT),
    FEEDBACK_ALREADY_SUBMITTED("feedback-already-submitted", HttpStatus.CONFLICT),
    DUPLICATE_CLUB_NAME("duplicate-club-name", HttpStatus.CONFLICT),
    DUPLICATE_EMAIL("duplicate-email", HttpStatus.CONFLICT),

    // lifecycle preconditions
    CLUB_INACTIVE("club-inactive", HttpStatus.CONFLICT),
    EVENT_NOT_UPCOMING("event-not-upcoming", HttpStatus.CONFLICT),
    DEADLINE_PASSED("deadline-passed", HttpStatus.CONFLICT),
    EVENT_NOT_COMPLETED("event-not-completed", HttpStatus.CONFLICT),
    INVALID_STATUS_TRANSITION("invalid-status-transition", HttpStatus.CONFLICT),
    NOT_ATTENDED("not-attended", HttpStatus.CONFLICT),

    // storage-level races surfaced by constraints and locks
    CONSTRAINT_CONFLICT("constraint-conflict", HttpStatus.CONFLICT),
    CONCURRENT_UPDATE("concurrent-update", HttpStatus.CONFLICT),

    // caller data inconsistent with stored state
    UNKNOWN_PARTICIPANT("unknown-participant", HttpStatus.BAD_REQUEST),
    INVALID_COORDINATOR("invalid-coordinator", HttpStatus.BAD_REQUEST),
    VALIDATION_ERROR("validation-error", HttpStatus.BAD_REQUEST),

    CLUB_NOT_FOUND("club-not-found", HttpStatus.NOT_FOUND),
    EVENT_NOT_FOUND("event-not-found", HttpStatus.NOT_FOUND),
    USER_NOT_FOUND("user-not-found", HttpStatus.NOT_FOUND),

    UNAUTHENTICATED("unauthenticated", HttpStatus.UNAUTHORIZED);

    private final String code;
    private final HttpStatus status;

    ErrorCode(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }
}
