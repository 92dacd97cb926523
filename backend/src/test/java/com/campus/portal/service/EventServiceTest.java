package com.campus.portal.service;

import com.campus.portal.config.PortalProperties;
import com.campus.portal.dto.CreateEventRequest;
import com.campus.portal.dto.DuplicateEventRequest;
import com.campus.portal.dto.UpdateEventRequest;
import com.campus.portal.entity.Club;
import com.campus.portal.entity.Event;
import com.campus.portal.entity.EventRegistration;
import com.campus.portal.entity.EventStatus;
import com.campus.portal.entity.RegistrationStatus;
import com.campus.portal.entity.Role;
import com.campus.portal.entity.User;
import com.campus.portal.error.ErrorCode;
import com.campus.portal.error.PermissionDeniedException;
import com.campus.portal.error.PortalException;
import com.campus.portal.mapper.EventMapper;
import com.campus.portal.repository.AttendanceRecordRepository;
import com.campus.portal.repository.ClubRepository;
import com.campus.portal.repository.EventFeedbackRepository;
import com.campus.portal.repository.EventRepository;
import com.campus.portal.security.AuthorizationGate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class EventServiceTest {

    // 2030-05-10 11:00 UTC
    private static final Instant NOW = Instant.parse("2030-05-10T11:00:00Z");

    private EventRepository events;
    private ClubRepository clubs;
    private EventMapper mapper;
    private EventService service;

    private User admin;
    private User teacher;
    private Club club;

    @BeforeEach
    void setUp() {
        events = Mockito.mock(EventRepository.class);
        clubs = Mockito.mock(ClubRepository.class);
        mapper = Mockito.mock(EventMapper.class);
        PortalProperties props = new PortalProperties();
        props.setZone("UTC");

        service = new EventService(events, clubs,
                Mockito.mock(AttendanceRecordRepository.class),
                Mockito.mock(EventFeedbackRepository.class),
                new AuthorizationGate(), mapper, props,
                Clock.fixed(NOW, ZoneOffset.UTC));

        admin = user(1L, Role.ADMIN);
        teacher = user(2L, Role.TEACHER);
        club = new Club();
        club.setId(5L);
        club.setCoordinator(teacher);

        Mockito.when(events.save(any(Event.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void sweepFollowsTheClock() {
        Event finished = event(EventStatus.UPCOMING, LocalDate.of(2030, 5, 9), 10, 12);
        Event running = event(EventStatus.UPCOMING, LocalDate.of(2030, 5, 10), 10, 12);
        Event runningOver = event(EventStatus.ONGOING, LocalDate.of(2030, 5, 10), 9, 10);
        Event later = event(EventStatus.UPCOMING, LocalDate.of(2030, 5, 11), 10, 12);
        Mockito.when(events.findByStatusIn(anyCollection()))
                .thenReturn(List.of(finished, running, runningOver, later));

        int changed = service.sweepStatuses();

        assertThat(changed).isEqualTo(3);
        assertThat(finished.getStatus()).isEqualTo(EventStatus.COMPLETED);
        assertThat(running.getStatus()).isEqualTo(EventStatus.ONGOING);
        assertThat(runningOver.getStatus()).isEqualTo(EventStatus.COMPLETED);
        assertThat(later.getStatus()).isEqualTo(EventStatus.UPCOMING);
    }

    @Test
    void terminalStatusCannotBeLeft() {
        Event done = event(EventStatus.COMPLETED, LocalDate.of(2030, 5, 1), 10, 12);
        Mockito.when(events.findByIdForUpdate(done.getId())).thenReturn(Optional.of(done));

        assertThatThrownBy(() -> service.advanceStatus(admin, done.getId(), EventStatus.ONGOING))
                .isInstanceOf(PortalException.class)
                .extracting(e -> ((PortalException) e).code())
                .isEqualTo(ErrorCode.INVALID_STATUS_TRANSITION);
        assertThat(done.getStatus()).isEqualTo(EventStatus.COMPLETED);
    }

    @Test
    void deadlineAfterStartIsRejected() {
        Mockito.when(clubs.findById(club.getId())).thenReturn(Optional.of(club));
        var req = new CreateEventRequest("Workshop", "Hands-on workshop.", club.getId(),
                LocalDate.of(2030, 6, 1), LocalTime.of(10, 0), LocalTime.of(12, 0), "Lab 1", 20,
                Instant.parse("2030-06-01T10:30:00Z"));

        assertThatThrownBy(() -> service.create(teacher, req))
                .extracting(e -> ((PortalException) e).code())
                .isEqualTo(ErrorCode.VALIDATION_ERROR);
        verify(events, never()).save(any(Event.class));
    }

    @Test
    void inactiveClubGetsNoNewEvents() {
        club.setActive(false);
        Mockito.when(clubs.findById(club.getId())).thenReturn(Optional.of(club));
        var req = new CreateEventRequest("Workshop", "Hands-on workshop.", club.getId(),
                LocalDate.of(2030, 6, 1), LocalTime.of(10, 0), LocalTime.of(12, 0), "Lab 1", 20,
                Instant.parse("2030-05-30T10:00:00Z"));

        assertThatThrownBy(() -> service.create(teacher, req))
                .extracting(e -> ((PortalException) e).code())
                .isEqualTo(ErrorCode.CLUB_INACTIVE);
    }

    @Test
    void capacityCannotDropBelowTheRoster() {
        Event e = event(EventStatus.UPCOMING, LocalDate.of(2030, 6, 1), 10, 12);
        e.setMaxParticipants(5);
        for (long uid = 100; uid < 103; uid++) {
            EventRegistration r = new EventRegistration();
            r.setEvent(e);
            r.setUser(user(uid, Role.STUDENT));
            r.setStatus(RegistrationStatus.REGISTERED);
            e.getRegistrations().add(r);
        }
        Mockito.when(events.findByIdForUpdate(e.getId())).thenReturn(Optional.of(e));
        Mockito.doAnswer(inv -> {
            e.setMaxParticipants(((UpdateEventRequest) inv.getArgument(0)).maxParticipants());
            return null;
        }).when(mapper).update(any(UpdateEventRequest.class), any(Event.class));

        var req = new UpdateEventRequest(null, null, null, null, null, null, 2, null);
        assertThatThrownBy(() -> service.update(teacher, e.getId(), req))
                .extracting(ex -> ((PortalException) ex).code())
                .isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    @Test
    void onlyUpcomingEventsCanBeEdited() {
        Event e = event(EventStatus.ONGOING, LocalDate.of(2030, 5, 10), 10, 12);
        Mockito.when(events.findByIdForUpdate(e.getId())).thenReturn(Optional.of(e));

        var req = new UpdateEventRequest("New title", null, null, null, null, null, null, null);
        assertThatThrownBy(() -> service.update(teacher, e.getId(), req))
                .extracting(ex -> ((PortalException) ex).code())
                .isEqualTo(ErrorCode.EVENT_NOT_UPCOMING);
    }

    @Test
    void duplicateCopiesDetailsButNotTheRoster() {
        Event source = event(EventStatus.COMPLETED, LocalDate.of(2030, 5, 1), 10, 12);
        source.setTitle("Hackathon");
        source.setDescription("Twenty-four hours of code.");
        source.setVenue("Lab 2");
        source.setMaxParticipants(40);
        EventRegistration r = new EventRegistration();
        r.setEvent(source);
        r.setUser(user(100L, Role.STUDENT));
        r.setStatus(RegistrationStatus.ATTENDED);
        source.getRegistrations().add(r);
        Mockito.when(events.findById(source.getId())).thenReturn(Optional.of(source));

        var req = new DuplicateEventRequest(null, LocalDate.of(2030, 9, 1), Instant.parse("2030-08-25T00:00:00Z"));
        service.duplicate(teacher, source.getId(), req);

        ArgumentCaptor<Event> saved = ArgumentCaptor.forClass(Event.class);
        verify(events).save(saved.capture());
        Event copy = saved.getValue();
        assertThat(copy.getTitle()).isEqualTo("Hackathon (Copy)");
        assertThat(copy.getVenue()).isEqualTo("Lab 2");
        assertThat(copy.getMaxParticipants()).isEqualTo(40);
        assertThat(copy.getEventDate()).isEqualTo(LocalDate.of(2030, 9, 1));
        assertThat(copy.getStatus()).isEqualTo(EventStatus.UPCOMING);
        assertThat(copy.getOrganizer()).isSameAs(teacher);
        assertThat(copy.getRegistrations()).isEmpty();
    }

    @Test
    void duplicateNeedsClubAuthority() {
        Event source = event(EventStatus.UPCOMING, LocalDate.of(2030, 6, 1), 10, 12);
        Mockito.when(events.findById(source.getId())).thenReturn(Optional.of(source));
        User outsider = user(9L, Role.TEACHER);

        var req = new DuplicateEventRequest("Again", LocalDate.of(2030, 9, 1), Instant.parse("2030-08-25T00:00:00Z"));
        assertThatThrownBy(() -> service.duplicate(outsider, source.getId(), req))
                .isInstanceOf(PermissionDeniedException.class);
        verify(events, never()).save(any(Event.class));
    }

    private long nextId = 1000;

    private Event event(EventStatus status, LocalDate date, int startHour, int endHour) {
        Event e = new Event();
        e.setId(nextId++);
        e.setClub(club);
        e.setTitle("Event");
        e.setEventDate(date);
        e.setStartTime(LocalTime.of(startHour, 0));
        e.setEndTime(LocalTime.of(endHour, 0));
        e.setRegistrationDeadline(date.atStartOfDay().toInstant(ZoneOffset.UTC));
        e.setStatus(status);
        return e;
    }

    private static User user(Long id, Role role) {
        User u = new User();
        u.setId(id);
        u.setRole(role);
        u.setActive(true);
        return u;
    }
}
