package com.campus.portal.support;

import com.campus.portal.entity.Club;
import com.campus.portal.entity.ClubCategory;
import com.campus.portal.entity.Event;
import com.campus.portal.entity.EventStatus;
import com.campus.portal.entity.Role;
import com.campus.portal.entity.User;
import com.campus.portal.repository.ClubRepository;
import com.campus.portal.repository.EventRepository;
import com.campus.portal.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/** Seeds rows straight through the repositories, bypassing the gate. Names are unique per call. */
@Component
@RequiredArgsConstructor
public class Fixtures {

    public static final String PASSWORD = "password-123";

    private final UserRepository users;
    private final ClubRepository clubs;
    private final EventRepository events;
    private final PasswordEncoder encoder;

    public User user(Role role) {
        String tag = tag();
        User u = new User();
        u.setEmail(role.name().toLowerCase() + "-" + tag + "@portal.test");
        u.setPasswordHash(encoder.encode(PASSWORD));
        u.setName(role.name().charAt(0) + role.name().substring(1).toLowerCase() + " " + tag);
        u.setRole(role);
        u.setActive(true);
        return users.save(u);
    }

    public User student() {
        return user(Role.STUDENT);
    }

    public User teacher() {
        return user(Role.TEACHER);
    }

    public User admin() {
        return user(Role.ADMIN);
    }

    public Club club(User coordinator) {
        Club c = new Club();
        c.setName("Club " + tag());
        c.setDescription("A club used by the test suite.");
        c.setCategory(ClubCategory.TECHNICAL);
        c.setContactEmail("club@portal.test");
        c.setCoordinator(coordinator);
        c.setActive(true);
        return clubs.save(c);
    }

    /** Upcoming event a week from now, registration open for another day. */
    public Event event(Club club, User organizer, int capacity) {
        return event(club, organizer, capacity, Instant.now().plus(1, ChronoUnit.DAYS));
    }

    public Event event(Club club, User organizer, int capacity, Instant deadline) {
        Event e = new Event();
        e.setTitle("Event " + tag());
        e.setDescription("An event used by the test suite.");
        e.setClub(club);
        e.setOrganizer(organizer);
        e.setEventDate(LocalDate.now().plusDays(7));
        e.setStartTime(LocalTime.of(10, 0));
        e.setEndTime(LocalTime.of(12, 0));
        e.setVenue("Hall A");
        e.setMaxParticipants(capacity);
        e.setRegistrationDeadline(deadline);
        e.setStatus(EventStatus.UPCOMING);
        return events.save(e);
    }

    public Event withStatus(Event e, EventStatus status) {
        Event fresh = events.findById(e.getId()).orElseThrow();
        fresh.setStatus(status);
        return events.save(fresh);
    }

    private static String tag() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
