package com.campus.portal.config;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class LoginRateLimiter {

    private final int limit;
    private final long windowMs;
    private final Clock clock;

    private static class Bucket { int count; long resetAt; }
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public LoginRateLimiter(PortalProperties props, Clock clock) {
        this.limit = props.getLogin().getMaxAttempts();
        this.windowMs = props.getLogin().getWindowMs();
        this.clock = clock;
    }

    public boolean allow(String key) {
        long now = clock.millis();
        Bucket b = buckets.computeIfAbsent(key, k -> { var nb = new Bucket(); nb.resetAt = now + windowMs; return nb; });
        synchronized (b) {
            if (now > b.resetAt) { b.count = 0; b.resetAt = now + windowMs; }
            if (b.count >= limit) return false;
            b.count++;
            return true;
        }
    }
}
