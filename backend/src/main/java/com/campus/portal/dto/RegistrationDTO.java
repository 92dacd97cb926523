package com.campus.portal.dto;

import com.campus.portal.entity.RegistrationStatus;

import java.time.Instant;

public record RegistrationDTO(
        Long eventId,
        String eventTitle,
        Long userId,
        String userName,
        RegistrationStatus status,
        Instant registrationDate
) {}
