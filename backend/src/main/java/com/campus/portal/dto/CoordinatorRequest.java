package com.campus.portal.dto;

import jakarta.validation.constraints.NotNull;

public record CoordinatorRequest(@NotNull Long userId) {}
