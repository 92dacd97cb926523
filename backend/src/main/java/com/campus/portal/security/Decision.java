package com.campus.portal.security;

public record Decision(boolean allowed, String reason) {

    public static final String UNAUTHENTICATED = "unauthenticated";
    public static final String INACTIVE_ACCOUNT = "inactive-account";
    public static final String INSUFFICIENT_ROLE = "insufficient-role";
    public static final String NOT_CLUB_AUTHORITY = "not-club-authority";
    public static final String EVENT_NOT_COMPLETED = "event-not-completed";
    public static final String SELF_ONLY = "self-only";
    public static final String MISSING_RESOURCE = "missing-resource";

    private static final Decision ALLOW = new Decision(true, null);

    public static Decision allow() {
        return ALLOW;
    }

    public static Decision deny(String reason) {
        return new Decision(false, reason);
    }
}
