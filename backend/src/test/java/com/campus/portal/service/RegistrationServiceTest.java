package com.campus.portal.service;

import com.campus.portal.dto.RegistrationDTO;
import com.campus.portal.entity.Club;
import com.campus.portal.entity.Event;
import com.campus.portal.entity.EventStatus;
import com.campus.portal.entity.RegistrationStatus;
import com.campus.portal.entity.User;
import com.campus.portal.error.ErrorCode;
import com.campus.portal.error.PermissionDeniedException;
import com.campus.portal.error.PortalException;
import com.campus.portal.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class RegistrationServiceTest {

    @Autowired Fixtures fx;
    @Autowired RegistrationService registrations;
    @Autowired EventService events;

    private User admin;
    private User teacher;
    private Club club;

    @BeforeEach
    void setUp() {
        admin = fx.admin();
        teacher = fx.teacher();
        club = fx.club(teacher);
    }

    @Test
    void thirdStudentIsTurnedAwayFromAFullEventAndGetsInAfterACancellation() {
        Event event = fx.event(club, teacher, 2);
        User x = fx.student();
        User y = fx.student();
        User z = fx.student();

        registrations.register(x, event.getId(), x.getId());
        registrations.register(y, event.getId(), y.getId());
        assertThatThrownBy(() -> registrations.register(z, event.getId(), z.getId()))
                .isInstanceOf(PortalException.class)
                .extracting(e -> ((PortalException) e).code())
                .isEqualTo(ErrorCode.EVENT_FULL);

        registrations.cancel(x, event.getId(), x.getId());
        RegistrationDTO zRow = registrations.register(z, event.getId(), z.getId());

        assertThat(zRow.status()).isEqualTo(RegistrationStatus.REGISTERED);
        assertThat(events.get(event.getId()).activeRegistrations()).isEqualTo(2);
        assertThat(events.get(event.getId()).full()).isTrue();
    }

    @Test
    void registerAndCancelLeaveTheActiveCountUnchangedAndReuseTheRow() {
        Event event = fx.event(club, teacher, 5);
        User s = fx.student();
        int before = events.get(event.getId()).activeRegistrations();

        registrations.register(s, event.getId(), s.getId());
        registrations.cancel(s, event.getId(), s.getId());
        assertThat(events.get(event.getId()).activeRegistrations()).isEqualTo(before);

        registrations.register(s, event.getId(), s.getId());
        List<RegistrationDTO> rows = events.participants(admin, event.getId());
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).status()).isEqualTo(RegistrationStatus.REGISTERED);
    }

    @Test
    void duplicateRegistrationIsRejectedEvenWhenTheEventIsFull() {
        Event event = fx.event(club, teacher, 1);
        User s = fx.student();
        registrations.register(s, event.getId(), s.getId());

        assertThatThrownBy(() -> registrations.register(s, event.getId(), s.getId()))
                .isInstanceOf(PortalException.class)
                .extracting(e -> ((PortalException) e).code())
                .isEqualTo(ErrorCode.ALREADY_REGISTERED);
    }

    @Test
    void unlimitedEventNeverFills() {
        Event event = fx.event(club, teacher, 0);
        for (int i = 0; i < 5; i++) {
            User s = fx.student();
            registrations.register(s, event.getId(), s.getId());
        }
        assertThat(events.get(event.getId()).full()).isFalse();
        assertThat(events.get(event.getId()).availableSpots()).isNull();
    }

    @Test
    void deadlineAndStatusAreCheckedBeforeTheRoster() {
        Event closed = fx.event(club, teacher, 5, Instant.now().minus(1, ChronoUnit.HOURS));
        User s = fx.student();
        assertThatThrownBy(() -> registrations.register(s, closed.getId(), s.getId()))
                .extracting(e -> ((PortalException) e).code())
                .isEqualTo(ErrorCode.DEADLINE_PASSED);

        Event cancelled = fx.withStatus(fx.event(club, teacher, 5), EventStatus.CANCELLED);
        assertThatThrownBy(() -> registrations.register(s, cancelled.getId(), s.getId()))
                .extracting(e -> ((PortalException) e).code())
                .isEqualTo(ErrorCode.EVENT_NOT_UPCOMING);
    }

    @Test
    void cancelNeedsAnActiveRowAndAnUpcomingEvent() {
        Event event = fx.event(club, teacher, 5);
        User s = fx.student();
        assertThatThrownBy(() -> registrations.cancel(s, event.getId(), s.getId()))
                .extracting(e -> ((PortalException) e).code())
                .isEqualTo(ErrorCode.NOT_REGISTERED);

        registrations.register(s, event.getId(), s.getId());
        events.advanceStatus(teacher, event.getId(), EventStatus.ONGOING);
        assertThatThrownBy(() -> registrations.cancel(s, event.getId(), s.getId()))
                .extracting(e -> ((PortalException) e).code())
                .isEqualTo(ErrorCode.EVENT_NOT_UPCOMING);
    }

    @Test
    void studentCannotRegisterSomeoneElse() {
        Event event = fx.event(club, teacher, 5);
        User s = fx.student();
        User other = fx.student();

        assertThatThrownBy(() -> registrations.register(s, event.getId(), other.getId()))
                .isInstanceOf(PermissionDeniedException.class);
        assertThat(events.get(event.getId()).activeRegistrations()).isZero();
    }

    @Test
    void concurrentRegistrationsNeverExceedCapacity() throws Exception {
        int capacity = 3;
        int attempts = 8;
        Event event = fx.event(club, teacher, capacity);
        List<User> students = new ArrayList<>();
        for (int i = 0; i < attempts; i++) {
            students.add(fx.student());
        }

        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (User s : students) {
                Callable<Boolean> task = () -> {
                    start.await();
                    try {
                        registrations.register(s, event.getId(), s.getId());
                        return true;
                    } catch (PortalException e) {
                        assertThat(e.code()).isEqualTo(ErrorCode.EVENT_FULL);
                        return false;
                    }
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            int ok = 0;
            for (Future<Boolean> f : results) {
                if (f.get(30, TimeUnit.SECONDS)) ok++;
            }
            assertThat(ok).isEqualTo(capacity);
        } finally {
            pool.shutdownNow();
        }
        assertThat(events.get(event.getId()).activeRegistrations()).isEqualTo(capacity);
    }
}
