package com.campus.portal.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Date-driven event status changes. Turned off with {@code portal.events.status-sweep-enabled=false}. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "portal.events", name = "status-sweep-enabled", havingValue = "true", matchIfMissing = true)
public class EventStatusScheduler {

    private final EventService events;

    @Scheduled(fixedDelayString = "${portal.events.status-sweep-ms:60000}", initialDelayString = "${portal.events.status-sweep-ms:60000}")
    public void sweep() {
        try {
            int changed = events.sweepStatuses();
            if (changed > 0) {
                log.info("status sweep moved {} event(s)", changed);
            }
        } catch (RuntimeException e) {
            // a concurrent roster change on one event rolls back the sweep; the next run retries
            log.warn("status sweep failed: {}", e.getMessage());
        }
    }
}
