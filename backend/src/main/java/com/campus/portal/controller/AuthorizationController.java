package com.campus.portal.controller;

import com.campus.portal.security.Action;
import com.campus.portal.security.Decision;
import com.campus.portal.service.PermissionService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/authorize")
@RequiredArgsConstructor
public class AuthorizationController {

    private final PermissionService permissions;
    private final CurrentUser currentUser;

    @GetMapping
    public Decision check(
            @RequestParam Action action,
            @RequestParam(required = false) Long clubId,
            @RequestParam(required = false) Long eventId,
            @RequestParam(required = false) Long userId
    ) {
        return permissions.check(currentUser.require(), action, clubId, eventId, userId);
    }
}
