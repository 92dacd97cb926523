package com.campus.portal.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.time.LocalDate;

/** New date and deadline for a copy; the title defaults to the original's with " (Copy)". */
public record DuplicateEventRequest(
        @Size(min = 3, max = 200) String title,
        @NotNull LocalDate eventDate,
        @NotNull Instant registrationDeadline
) {}
