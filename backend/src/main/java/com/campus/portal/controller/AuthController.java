package com.campus.portal.controller;

import com.campus.portal.config.LoginRateLimiter;
import com.campus.portal.dto.LoginRequest;
import com.campus.portal.dto.LoginResponse;
import com.campus.portal.dto.SignupRequest;
import com.campus.portal.service.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.NoSuchElementException;

@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final LoginRateLimiter limiter;

    @PostMapping("/login")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request, HttpServletRequest http) {
        String key = http.getRemoteAddr();
        if (!limiter.allow(key)) {
            log.warn("login rate limit hit for {}", key);
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(Map.of("status", "error", "reason", "too-many-attempts"));
        }

        try {
            LoginResponse resp = authService.login(request);
            return ResponseEntity.ok(resp);
        } catch (NoSuchElementException | IllegalArgumentException e) {
            // unknown user, wrong password and inactive account look the same to the caller
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("status", "error", "reason", "invalid-credentials"));
        }
    }

    @PostMapping("/register")
    public ResponseEntity<LoginResponse> register(@Valid @RequestBody SignupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.signup(request));
    }
}
