package com.campus.portal.dto;

import com.campus.portal.entity.ClubCategory;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateClubRequest(
        @NotBlank @Size(min = 2, max = 100) String name,
        @NotBlank @Size(min = 10, max = 2000) String description,
        @NotNull ClubCategory category,
        @Email String contactEmail,
        @NotNull Long coordinatorId
) {}
