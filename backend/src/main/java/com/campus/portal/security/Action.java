package com.campus.portal.security;

/**
 * Every mutation (and the few guarded reads) the portal performs,
 * grouped by the rule of {@link AuthorizationGate} that decides it.
 */
public enum Action {

    CREATE_CLUB(Rule.ADMIN_ONLY),
    DELETE_CLUB(Rule.ADMIN_ONLY),
    SET_COORDINATOR(Rule.ADMIN_ONLY),
    UPDATE_CLUB(Rule.CLUB_AUTHORITY),
    PROMOTE_MEMBER(Rule.CLUB_AUTHORITY),

    CREATE_EVENT(Rule.CLUB_AUTHORITY),
    UPDATE_EVENT(Rule.CLUB_AUTHORITY),
    DELETE_EVENT(Rule.CLUB_AUTHORITY),
    ADVANCE_EVENT_STATUS(Rule.CLUB_AUTHORITY),
    VIEW_PARTICIPANTS(Rule.CLUB_AUTHORITY),

    MARK_ATTENDANCE(Rule.ATTENDANCE),

    JOIN_CLUB(Rule.SELF),
    LEAVE_CLUB(Rule.SELF),
    REGISTER_EVENT(Rule.SELF),
    CANCEL_REGISTRATION(Rule.SELF),
    SUBMIT_FEEDBACK(Rule.SELF),
    // admins pass before any rule, so self-only here means "own profile or admin"
    UPDATE_PROFILE(Rule.SELF),

    VIEW_ATTENDANCE_HISTORY(Rule.SELF_OR_STAFF),
    LIST_USERS(Rule.STAFF),
    VIEW_CLUB_REPORT(Rule.STAFF),
    MANAGE_USERS(Rule.ADMIN_ONLY);

    enum Rule {
        /** Admin only; teachers and students get insufficient-role. */
        ADMIN_ONLY,
        /** Teacher who coordinates or leads the club. */
        CLUB_AUTHORITY,
        /** Teacher, and the event must be completed. */
        ATTENDANCE,
        /** Any role, acting on its own identity. */
        SELF,
        /** Teachers for anyone, students for themselves. */
        SELF_OR_STAFF,
        /** Any teacher. */
        STAFF
    }

    private final Rule rule;

    Action(Rule rule) {
        this.rule = rule;
    }

    Rule rule() {
        return rule;
    }
}
