package com.campus.portal.dto;

import java.time.Instant;

public record FeedbackDTO(
        Long id,
        Long eventId,
        Long userId,
        String userName,
        int rating,
        String comment,
        Instant createdAt
) {}
