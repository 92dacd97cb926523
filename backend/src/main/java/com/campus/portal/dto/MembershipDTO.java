package com.campus.portal.dto;

import com.campus.portal.entity.MembershipRole;

import java.time.Instant;

public record MembershipDTO(
        Long userId,
        String userName,
        MembershipRole role,
        Instant joinedAt,
        boolean active
) {}
