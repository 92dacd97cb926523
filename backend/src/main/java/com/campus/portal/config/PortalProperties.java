package com.campus.portal.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "portal")
public class PortalProperties {

    /** Zone that event dates and start/end times are expressed in. */
    private String zone = "Europe/Istanbul";

    private final Login login = new Login();
    private final Events events = new Events();
    private final Bootstrap bootstrap = new Bootstrap();

    @Data
    public static class Login {
        private int maxAttempts = 5;       // per remote address
        private long windowMs = 60_000;
    }

    @Data
    public static class Events {
        private boolean statusSweepEnabled = true;
        private long statusSweepMs = 60_000;
    }

    /** First admin account, created on startup when no user has this email yet. */
    @Data
    public static class Bootstrap {
        private String adminEmail;
        private String adminPassword;
        private String adminName = "Portal Admin";
    }
}
