package com.campus.portal.dto;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

// null fields are left unchanged
public record UpdateEventRequest(
        @Size(min = 3, max = 200) String title,
        @Size(min = 10, max = 5000) String description,
        LocalDate eventDate,
        LocalTime startTime,
        LocalTime endTime,
        @Size(max = 200) String venue,
        @PositiveOrZero Integer maxParticipants,
        Instant registrationDeadline
) {}
