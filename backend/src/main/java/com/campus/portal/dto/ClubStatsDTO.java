package com.campus.portal.dto;

/** Recomputed from the rosters on every read. */
public record ClubStatsDTO(
        Long clubId,
        int activeMembers,
        int totalMembershipRows,
        int totalEvents,
        int completedEvents,
        int averageAttendance
) {}
