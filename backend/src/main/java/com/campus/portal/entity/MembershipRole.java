package com.campus.portal.entity;

public enum MembershipRole {
    MEMBER,
    LEADER,
    COORDINATOR;

    /** Leaders and coordinators may manage the club's events. */
    public boolean isAuthority() {
        return this == LEADER || this == COORDINATOR;
    }
}
