package com.campus.portal.error;

/**
 * Expected, user-facing failure of a portal operation.
 * Thrown inside a transaction, so nothing it interrupts is persisted.
 */
public class PortalException extends RuntimeException {

    private final ErrorCode code;

    public PortalException(ErrorCode code) {
        this(code, code.code());
    }

    public PortalException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
