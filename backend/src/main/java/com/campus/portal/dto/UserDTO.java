package com.campus.portal.dto;

import com.campus.portal.entity.Role;

import java.time.Instant;

public record UserDTO(
        Long id,
        String email,
        String name,
        Role role,
        String department,
        boolean active,
        Instant createdAt
) {}
