package com.campus.portal.dto;

import jakarta.validation.constraints.NotNull;

import java.util.Set;

/** The complete set of present users; everyone else registered counts as absent. */
public record AttendanceRequest(@NotNull Set<@NotNull Long> presentUserIds) {}
