package com.campus.portal.dto;

import jakarta.validation.constraints.Size;

// null fields are left unchanged; email and role are not editable
public record UpdateProfileRequest(
        @Size(min = 2, max = 100) String name,
        @Size(max = 100) String department
) {}
