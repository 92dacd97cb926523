package com.campus.portal.service;

import com.campus.portal.config.PortalProperties;
import com.campus.portal.entity.Role;
import com.campus.portal.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/** Creates the first admin from configuration; without one nobody could create clubs. */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminBootstrap implements CommandLineRunner {

    private final PortalProperties props;
    private final UserRepository users;
    private final UserService userService;

    @Override
    public void run(String... args) {
        var boot = props.getBootstrap();
        if (boot.getAdminEmail() == null || boot.getAdminEmail().isBlank()
                || boot.getAdminPassword() == null || boot.getAdminPassword().isBlank()) {
            return;
        }
        if (users.existsByEmail(AuthService.normalize(boot.getAdminEmail()))) {
            return;
        }
        var admin = userService.createAccount(
                boot.getAdminEmail(), boot.getAdminPassword(), boot.getAdminName(), null, Role.ADMIN);
        log.info("bootstrap admin created id={}", admin.getId());
    }
}
