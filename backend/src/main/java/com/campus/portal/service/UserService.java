package com.campus.portal.service;

import com.campus.portal.dto.CreateUserRequest;
import com.campus.portal.dto.UpdateProfileRequest;
import com.campus.portal.dto.UserDTO;
import com.campus.portal.entity.Role;
import com.campus.portal.entity.User;
import com.campus.portal.error.ErrorCode;
import com.campus.portal.error.PortalException;
import com.campus.portal.mapper.UserMapper;
import com.campus.portal.repository.UserRepository;
import com.campus.portal.security.Action;
import com.campus.portal.security.AuthorizationGate;
import com.campus.portal.security.ResourceRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository users;
    private final PasswordEncoder passwordEncoder;
    private final AuthorizationGate gate;
    private final UserMapper mapper;

    @Transactional(readOnly = true)
    public User require(Long userId) {
        return users.findById(userId)
                .orElseThrow(() -> new PortalException(ErrorCode.USER_NOT_FOUND, "user " + userId + " not found"));
    }

    @Transactional(readOnly = true)
    public UserDTO get(Long userId) {
        return mapper.toDto(require(userId));
    }

    @Transactional(readOnly = true)
    public Page<UserDTO> list(User actor, Role role, Pageable pageable) {
        gate.require(actor, Action.LIST_USERS, ResourceRef.none());
        Page<User> page = role == null ? users.findAll(pageable) : users.findByRole(role, pageable);
        return page.map(mapper::toDto);
    }

    @Transactional
    public UserDTO create(User actor, CreateUserRequest req) {
        gate.require(actor, Action.MANAGE_USERS, ResourceRef.none());
        User created = createAccount(req.email(), req.password(), req.name(), req.department(), req.role());
        log.info("user={} created account={} role={}", actor.getId(), created.getId(), created.getRole());
        return mapper.toDto(created);
    }

    @Transactional
    public UserDTO setActive(User actor, Long userId, boolean active) {
        gate.require(actor, Action.MANAGE_USERS, ResourceRef.subject(userId));
        User user = require(userId);
        user.setActive(active);
        log.info("user={} set account={} active={}", actor.getId(), userId, active);
        return mapper.toDto(users.save(user));
    }

    @Transactional
    public UserDTO updateProfile(User actor, Long userId, UpdateProfileRequest req) {
        gate.require(actor, Action.UPDATE_PROFILE, ResourceRef.subject(userId));
        User user = require(userId);
        if (req.name() != null) {
            user.setName(req.name().trim());
        }
        if (req.department() != null) {
            user.setDepartment(req.department().isBlank() ? null : req.department().trim());
        }
        log.info("user={} updated profile of user={}", actor.getId(), userId);
        return mapper.toDto(users.save(user));
    }

    @Transactional
    User createAccount(String email, String password, String name, String department, Role role) {
        String normalized = AuthService.normalize(email);
        if (users.existsByEmail(normalized)) {
            throw new PortalException(ErrorCode.DUPLICATE_EMAIL, "email already registered");
        }
        User u = new User();
        u.setEmail(normalized);
        u.setPasswordHash(passwordEncoder.encode(password));
        u.setName(name.trim());
        u.setDepartment(department);
        u.setRole(role);
        u.setActive(true);
        return users.save(u);
    }
}
