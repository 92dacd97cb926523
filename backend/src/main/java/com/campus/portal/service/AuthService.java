package com.campus.portal.service;

import com.campus.portal.dto.LoginRequest;
import com.campus.portal.dto.LoginResponse;
import com.campus.portal.dto.SignupRequest;
import com.campus.portal.entity.Role;
import com.campus.portal.entity.User;
import com.campus.portal.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.NoSuchElementException;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final UserService userService;

    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        User user = userRepository.findByEmail(normalize(request.email()))
                .orElseThrow(() -> new NoSuchElementException("user not found"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new IllegalArgumentException("bad credentials");
        }
        if (!user.isActive()) {
            throw new IllegalArgumentException("account inactive");
        }

        String token = jwtService.generateToken(user.getId(), user.getRole().name());
        log.info("login user={}", user.getId());
        return new LoginResponse(user.getId(), user.getRole().name(), token);
    }

    /** Self-registration. The role is fixed to student; staff accounts come from an admin. */
    @Transactional
    public LoginResponse signup(SignupRequest request) {
        User user = userService.createAccount(
                request.email(), request.password(), request.name(), request.department(), Role.STUDENT);
        String token = jwtService.generateToken(user.getId(), user.getRole().name());
        return new LoginResponse(user.getId(), user.getRole().name(), token);
    }

    static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase();
    }
}
