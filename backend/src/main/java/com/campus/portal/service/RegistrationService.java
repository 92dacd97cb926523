package com.campus.portal.service;

import com.campus.portal.dto.RegistrationDTO;
import com.campus.portal.entity.Event;
import com.campus.portal.entity.EventRegistration;
import com.campus.portal.entity.EventStatus;
import com.campus.portal.entity.RegistrationStatus;
import com.campus.portal.entity.User;
import com.campus.portal.error.ErrorCode;
import com.campus.portal.error.PortalException;
import com.campus.portal.mapper.EventMapper;
import com.campus.portal.repository.EventRegistrationRepository;
import com.campus.portal.repository.EventRepository;
import com.campus.portal.security.Action;
import com.campus.portal.security.AuthorizationGate;
import com.campus.portal.security.ResourceRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Event rosters. A row moves registered → cancelled by the student, or
 * registered → attended by the attendance recorder only.
 * <p>
 * Register and cancel run under the event row lock, so the capacity check and
 * the insert it guards are one serialized step per event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationService {

    private final EventRepository events;
    private final EventRegistrationRepository registrations;
    private final UserService userService;
    private final AuthorizationGate gate;
    private final EventMapper mapper;
    private final Clock clock;

    /**
     * Checks, in order: event is upcoming, deadline not passed, no active row for the
     * user, a seat is free. The duplicate check runs before the capacity check so a
     * repeated attempt can never count against capacity.
     */
    @Transactional
    public RegistrationDTO register(User actor, Long eventId, Long userId) {
        Event event = lock(eventId);
        gate.require(actor, Action.REGISTER_EVENT, ResourceRef.eventSubject(event, userId));
        Instant now = clock.instant();

        if (event.getStatus() != EventStatus.UPCOMING) {
            throw new PortalException(ErrorCode.EVENT_NOT_UPCOMING, "event " + eventId + " is " + event.getStatus());
        }
        if (now.isAfter(event.getRegistrationDeadline())) {
            throw new PortalException(ErrorCode.DEADLINE_PASSED, "registration closed at " + event.getRegistrationDeadline());
        }
        if (event.activeRegistrationOf(userId).isPresent()) {
            throw new PortalException(ErrorCode.ALREADY_REGISTERED, "user " + userId + " is already registered");
        }
        if (event.isFull()) {
            throw new PortalException(ErrorCode.EVENT_FULL, "event " + eventId + " is full (" + event.getMaxParticipants() + ")");
        }

        // one row per (event, user): a cancelled row is reused
        EventRegistration row = event.registrationOf(userId).orElse(null);
        if (row == null) {
            row = new EventRegistration();
            row.setEvent(event);
            row.setUser(userService.require(userId));
            event.getRegistrations().add(row);
        }
        row.setStatus(RegistrationStatus.REGISTERED);
        row.setRegistrationDate(now);
        registrations.save(row);

        log.info("user={} registered for event={} seats={}/{}", userId, eventId,
                event.activeRegistrationCount(), event.isUnlimited() ? "unlimited" : event.getMaxParticipants());
        return mapper.toDto(row);
    }

    /** Frees the seat. Not possible once the event has left the upcoming state. */
    @Transactional
    public void cancel(User actor, Long eventId, Long userId) {
        Event event = lock(eventId);
        gate.require(actor, Action.CANCEL_REGISTRATION, ResourceRef.eventSubject(event, userId));

        EventRegistration row = event.activeRegistrationOf(userId)
                .orElseThrow(() -> new PortalException(ErrorCode.NOT_REGISTERED, "user " + userId + " is not registered"));
        if (event.getStatus() != EventStatus.UPCOMING || row.getStatus() == RegistrationStatus.ATTENDED) {
            throw new PortalException(ErrorCode.EVENT_NOT_UPCOMING, "cannot cancel after the event has started");
        }
        row.setStatus(RegistrationStatus.CANCELLED);
        registrations.save(row);

        log.info("user={} cancelled registration for event={}", userId, eventId);
    }

    @Transactional(readOnly = true)
    public List<RegistrationDTO> activeRegistrationsOf(Long userId) {
        return registrations.findByUser_IdAndStatusInOrderByRegistrationDateDesc(
                        userId, EnumSet.of(RegistrationStatus.REGISTERED, RegistrationStatus.ATTENDED))
                .stream()
                .map(mapper::toDto)
                .toList();
    }

    private Event lock(Long eventId) {
        return events.findByIdForUpdate(eventId)
                .orElseThrow(() -> new PortalException(ErrorCode.EVENT_NOT_FOUND, "event " + eventId + " not found"));
    }
}
