package com.campus.portal.dto;

import com.campus.portal.entity.EventStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

public record EventDTO(
        Long id,
        String title,
        String description,
        Long clubId,
        String clubName,
        Long organizerId,
        LocalDate eventDate,
        LocalTime startTime,
        LocalTime endTime,
        String venue,
        int maxParticipants,
        Instant registrationDeadline,
        EventStatus status,
        int activeRegistrations,
        Integer availableSpots,
        boolean full,
        boolean registrationOpen
) {}
