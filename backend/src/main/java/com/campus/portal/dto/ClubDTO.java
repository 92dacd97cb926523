package com.campus.portal.dto;

import com.campus.portal.entity.ClubCategory;

import java.time.Instant;

public record ClubDTO(
        Long id,
        String name,
        String description,
        ClubCategory category,
        String contactEmail,
        Long coordinatorId,
        String coordinatorName,
        int memberCount,
        boolean active,
        Instant createdAt
) {}
