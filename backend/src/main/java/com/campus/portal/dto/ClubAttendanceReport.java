package com.campus.portal.dto;

import com.campus.portal.entity.EventStatus;

import java.time.LocalDate;
import java.util.List;

public record ClubAttendanceReport(
        Long clubId,
        String clubName,
        LocalDate from,
        LocalDate to,
        int totalEvents,
        int totalRegistrations,
        int totalAttendance,
        int attendanceRate,
        List<EventLine> events,
        List<MonthLine> months
) {

    public record EventLine(
            Long eventId,
            String title,
            LocalDate eventDate,
            String venue,
            EventStatus status,
            int registered,
            int attended,
            int attendanceRate
    ) {}

    /** {@code month} is yyyy-MM. */
    public record MonthLine(String month, int events, int registered, int attended) {}
}
