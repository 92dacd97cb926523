package com.campus.portal.controller;

import com.campus.portal.dto.ActiveRequest;
import com.campus.portal.dto.ClubDTO;
import com.campus.portal.dto.CreateUserRequest;
import com.campus.portal.dto.RegistrationDTO;
import com.campus.portal.dto.UpdateProfileRequest;
import com.campus.portal.dto.UserDTO;
import com.campus.portal.entity.Role;
import com.campus.portal.service.MembershipService;
import com.campus.portal.service.RegistrationService;
import com.campus.portal.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService users;
    private final MembershipService memberships;
    private final RegistrationService registrations;
    private final CurrentUser currentUser;

    @GetMapping("/me")
    public UserDTO me() {
        return users.get(currentUser.require().getId());
    }

    @GetMapping("/me/clubs")
    public List<ClubDTO> myClubs() {
        return memberships.clubsOf(currentUser.require().getId());
    }

    @GetMapping("/me/registrations")
    public List<RegistrationDTO> myRegistrations() {
        return registrations.activeRegistrationsOf(currentUser.require().getId());
    }

    @GetMapping
    public Page<UserDTO> list(@RequestParam(required = false) Role role, Pageable pageable) {
        return users.list(currentUser.require(), role, pageable);
    }

    @PostMapping
    public ResponseEntity<UserDTO> create(@Valid @RequestBody CreateUserRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(users.create(currentUser.require(), req));
    }

    @PutMapping("/{id}")
    public UserDTO updateProfile(@PathVariable Long id, @Valid @RequestBody UpdateProfileRequest req) {
        return users.updateProfile(currentUser.require(), id, req);
    }

    @PutMapping("/{id}/active")
    public UserDTO setActive(@PathVariable Long id, @Valid @RequestBody ActiveRequest req) {
        return users.setActive(currentUser.require(), id, req.active());
    }
}
