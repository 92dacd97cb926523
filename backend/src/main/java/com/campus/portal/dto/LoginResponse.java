package com.campus.portal.dto;

public record LoginResponse(Long userId, String role, String token) {}
