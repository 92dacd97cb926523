package com.campus.portal.dto;

import java.time.Instant;

public record AttendanceRecordDTO(
        Long eventId,
        String eventTitle,
        Long userId,
        String userName,
        Instant markedAt
) {}
