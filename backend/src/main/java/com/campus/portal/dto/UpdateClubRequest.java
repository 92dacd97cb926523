package com.campus.portal.dto;

import com.campus.portal.entity.ClubCategory;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

// null fields are left unchanged
public record UpdateClubRequest(
        @Size(min = 2, max = 100) String name,
        @Size(min = 10, max = 2000) String description,
        ClubCategory category,
        @Email String contactEmail
) {}
