package com.campus.portal.dto;

import com.campus.portal.entity.EventStatus;
import jakarta.validation.constraints.NotNull;

public record StatusChangeRequest(@NotNull EventStatus status) {}
