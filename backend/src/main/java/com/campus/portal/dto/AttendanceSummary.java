package com.campus.portal.dto;

import java.util.List;

public record AttendanceSummary(
        Long eventId,
        int registered,
        int attended,
        int absent,
        int attendanceRate,
        List<AttendanceRecordDTO> attendees
) {}
