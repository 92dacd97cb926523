package com.campus.portal.error;

import com.campus.portal.security.Action;

public class PermissionDeniedException extends RuntimeException {

    private final Action action;
    private final String reason;

    public PermissionDeniedException(Action action, String reason) {
        super(action + " denied: " + reason);
        this.action = action;
        this.reason = reason;
    }

    public Action action() {
        return action;
    }

    /** Stable reason code from the authorization gate, e.g. "self-only". */
    public String reason() {
        return reason;
    }
}
