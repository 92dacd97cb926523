package com.campus.portal.dto;

import com.campus.portal.entity.MembershipRole;
import jakarta.validation.constraints.NotNull;

public record RoleChangeRequest(@NotNull MembershipRole role) {}
