package com.campus.portal.controller;

import com.campus.portal.entity.User;
import com.campus.portal.error.ErrorCode;
import com.campus.portal.error.PortalException;
import com.campus.portal.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Resolves the caller from the JWT principal (user id). The account is reloaded on
 * every request so role and active flag are never taken from the token.
 */
@Component
@RequiredArgsConstructor
public class CurrentUser {

    private final UserRepository users;

    public User require() {
        var auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || auth instanceof AnonymousAuthenticationToken || auth.getPrincipal() == null) {
            throw new PortalException(ErrorCode.UNAUTHENTICATED, "login required");
        }
        Long userId;
        try {
            userId = Long.valueOf(auth.getPrincipal().toString());
        } catch (NumberFormatException e) {
            throw new PortalException(ErrorCode.UNAUTHENTICATED, "malformed principal");
        }
        return users.findById(userId)
                .orElseThrow(() -> new PortalException(ErrorCode.UNAUTHENTICATED, "account no longer exists"));
    }
}
