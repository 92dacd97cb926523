package com.campus.portal.service;

import com.campus.portal.config.PortalProperties;
import com.campus.portal.dto.CreateEventRequest;
import com.campus.portal.dto.DuplicateEventRequest;
import com.campus.portal.dto.EventDTO;
import com.campus.portal.dto.RegistrationDTO;
import com.campus.portal.dto.UpdateEventRequest;
import com.campus.portal.entity.Club;
import com.campus.portal.entity.Event;
import com.campus.portal.entity.EventStatus;
import com.campus.portal.entity.User;
import com.campus.portal.error.ErrorCode;
import com.campus.portal.error.PortalException;
import com.campus.portal.mapper.EventMapper;
import com.campus.portal.repository.AttendanceRecordRepository;
import com.campus.portal.repository.ClubRepository;
import com.campus.portal.repository.EventFeedbackRepository;
import com.campus.portal.repository.EventRepository;
import com.campus.portal.repository.EventSpecs;
import com.campus.portal.security.Action;
import com.campus.portal.security.AuthorizationGate;
import com.campus.portal.security.ResourceRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;

/** Event definitions and their lifecycle status. */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventService {

    private final EventRepository events;
    private final ClubRepository clubs;
    private final AttendanceRecordRepository attendance;
    private final EventFeedbackRepository feedback;
    private final AuthorizationGate gate;
    private final EventMapper mapper;
    private final PortalProperties props;
    private final Clock clock;

    @Transactional
    public EventDTO create(User actor, CreateEventRequest req) {
        Club club = clubs.findById(req.clubId())
                .orElseThrow(() -> new PortalException(ErrorCode.CLUB_NOT_FOUND, "club " + req.clubId() + " not found"));
        gate.require(actor, Action.CREATE_EVENT, ResourceRef.club(club));
        if (!club.isActive()) {
            throw new PortalException(ErrorCode.CLUB_INACTIVE, "club " + club.getId() + " is not active");
        }

        Event e = new Event();
        e.setTitle(req.title().trim());
        e.setDescription(req.description().trim());
        e.setClub(club);
        e.setOrganizer(actor);
        e.setEventDate(req.eventDate());
        e.setStartTime(req.startTime());
        e.setEndTime(req.endTime());
        e.setVenue(req.venue().trim());
        e.setMaxParticipants(req.maxParticipants() == null ? 0 : req.maxParticipants());
        e.setRegistrationDeadline(req.registrationDeadline());
        e.setStatus(EventStatus.UPCOMING);
        checkSchedule(e);

        Event saved = events.save(e);
        log.info("user={} created event={} club={} capacity={}", actor.getId(), saved.getId(), club.getId(), saved.getMaxParticipants());
        return mapper.toDto(saved, clock.instant());
    }

    /** Details can change only while the event is upcoming; capacity never drops below the current roster. */
    @Transactional
    public EventDTO update(User actor, Long eventId, UpdateEventRequest req) {
        Event event = lock(eventId);
        gate.require(actor, Action.UPDATE_EVENT, ResourceRef.event(event));
        if (event.getStatus() != EventStatus.UPCOMING) {
            throw new PortalException(ErrorCode.EVENT_NOT_UPCOMING, "event " + eventId + " is " + event.getStatus());
        }

        mapper.update(req, event);
        checkSchedule(event);
        if (!event.isUnlimited() && event.getMaxParticipants() < event.activeRegistrationCount()) {
            throw new PortalException(ErrorCode.VALIDATION_ERROR,
                    "capacity " + event.getMaxParticipants() + " is below current registrations " + event.activeRegistrationCount());
        }

        log.info("user={} updated event={}", actor.getId(), eventId);
        return mapper.toDto(events.save(event), clock.instant());
    }

    @Transactional
    public void delete(User actor, Long eventId) {
        Event event = lock(eventId);
        gate.require(actor, Action.DELETE_EVENT, ResourceRef.event(event));
        purge(event);
        log.info("user={} deleted event={}", actor.getId(), eventId);
    }

    /**
     * Copies an event's details onto a new date under the same club. The copy starts
     * upcoming with an empty roster and is organized by the caller.
     */
    @Transactional
    public EventDTO duplicate(User actor, Long eventId, DuplicateEventRequest req) {
        Event source = require(eventId);
        Club club = source.getClub();
        gate.require(actor, Action.CREATE_EVENT, ResourceRef.club(club));
        if (!club.isActive()) {
            throw new PortalException(ErrorCode.CLUB_INACTIVE, "club " + club.getId() + " is not active");
        }

        Event copy = new Event();
        copy.setTitle(req.title() == null ? source.getTitle() + " (Copy)" : req.title().trim());
        copy.setDescription(source.getDescription());
        copy.setClub(club);
        copy.setOrganizer(actor);
        copy.setEventDate(req.eventDate());
        copy.setStartTime(source.getStartTime());
        copy.setEndTime(source.getEndTime());
        copy.setVenue(source.getVenue());
        copy.setMaxParticipants(source.getMaxParticipants());
        copy.setRegistrationDeadline(req.registrationDeadline());
        copy.setStatus(EventStatus.UPCOMING);
        checkSchedule(copy);

        Event saved = events.save(copy);
        log.info("user={} duplicated event={} as event={}", actor.getId(), eventId, saved.getId());
        return mapper.toDto(saved, clock.instant());
    }

    /** Moves the event forward along the lifecycle; terminal states and regressions are rejected. */
    @Transactional
    public EventDTO advanceStatus(User actor, Long eventId, EventStatus target) {
        Event event = lock(eventId);
        gate.require(actor, Action.ADVANCE_EVENT_STATUS, ResourceRef.event(event));

        EventStatus current = event.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new PortalException(ErrorCode.INVALID_STATUS_TRANSITION, current + " -> " + target + " is not allowed");
        }
        event.setStatus(target);

        log.info("user={} moved event={} {} -> {}", actor.getId(), eventId, current, target);
        return mapper.toDto(events.save(event), clock.instant());
    }

    /**
     * Date-driven transitions: an upcoming event becomes ongoing at its start time,
     * and upcoming or ongoing events become completed once their end time has passed.
     *
     * @return number of events whose status changed
     */
    @Transactional
    public int sweepStatuses() {
        Instant now = clock.instant();
        ZoneId zone = ZoneId.of(props.getZone());
        int changed = 0;

        for (Event e : events.findByStatusIn(EnumSet.of(EventStatus.UPCOMING, EventStatus.ONGOING))) {
            EventStatus next = e.getStatus();
            if (!now.isBefore(e.endsAt(zone))) {
                next = EventStatus.COMPLETED;
            } else if (e.getStatus() == EventStatus.UPCOMING && !now.isBefore(e.startsAt(zone))) {
                next = EventStatus.ONGOING;
            }
            if (next != e.getStatus()) {
                log.info("event={} {} -> {} (scheduled)", e.getId(), e.getStatus(), next);
                e.setStatus(next);
                changed++;
            }
        }
        return changed;
    }

    @Transactional(readOnly = true)
    public EventDTO get(Long eventId) {
        return mapper.toDto(require(eventId), clock.instant());
    }

    @Transactional(readOnly = true)
    public Page<EventDTO> list(Long clubId, EventStatus status, String q, Pageable pageable) {
        Specification<Event> spec = EventSpecs.inClub(clubId)
                .and(EventSpecs.hasStatus(status))
                .and(EventSpecs.textLike(q));
        Instant now = clock.instant();
        return events.findAll(spec, pageable).map(e -> mapper.toDto(e, now));
    }

    @Transactional(readOnly = true)
    public List<EventDTO> upcoming(int limit) {
        Instant now = clock.instant();
        LocalDate today = LocalDate.now(clock);
        return events.findByStatusAndEventDateGreaterThanEqualOrderByEventDateAscStartTimeAsc(
                        EventStatus.UPCOMING, today, PageRequest.of(0, Math.max(1, Math.min(limit, 100))))
                .stream()
                .map(e -> mapper.toDto(e, now))
                .toList();
    }

    /** Full registration snapshot, cancelled rows included, in registration order. */
    @Transactional(readOnly = true)
    public List<RegistrationDTO> participants(User actor, Long eventId) {
        Event event = require(eventId);
        gate.require(actor, Action.VIEW_PARTICIPANTS, ResourceRef.event(event));
        return event.getRegistrations().stream().map(mapper::toDto).toList();
    }

    // attendance and feedback only reference the event, so they are removed explicitly
    void purge(Event event) {
        attendance.deleteByEvent_Id(event.getId());
        feedback.deleteByEvent_Id(event.getId());
        events.delete(event);
    }

    Event require(Long eventId) {
        return events.findById(eventId)
                .orElseThrow(() -> new PortalException(ErrorCode.EVENT_NOT_FOUND, "event " + eventId + " not found"));
    }

    private Event lock(Long eventId) {
        return events.findByIdForUpdate(eventId)
                .orElseThrow(() -> new PortalException(ErrorCode.EVENT_NOT_FOUND, "event " + eventId + " not found"));
    }

    private void checkSchedule(Event e) {
        if (!e.getEndTime().isAfter(e.getStartTime())) {
            throw new PortalException(ErrorCode.VALIDATION_ERROR, "end time must be after start time");
        }
        Instant start = e.startsAt(ZoneId.of(props.getZone()));
        if (e.getRegistrationDeadline().isAfter(start)) {
            throw new PortalException(ErrorCode.VALIDATION_ERROR, "registration deadline must not be after the event start");
        }
    }
}
