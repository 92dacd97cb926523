package com.campus.portal.dto;

import java.util.List;

public record FeedbackSummary(
        Long eventId,
        int count,
        double averageRating,
        List<FeedbackDTO> items
) {}
