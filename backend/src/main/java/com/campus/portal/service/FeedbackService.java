package com.campus.portal.service;

import com.campus.portal.dto.FeedbackDTO;
import com.campus.portal.dto.FeedbackRequest;
import com.campus.portal.dto.FeedbackSummary;
import com.campus.portal.entity.Event;
import com.campus.portal.entity.EventFeedback;
import com.campus.portal.entity.RegistrationStatus;
import com.campus.portal.entity.User;
import com.campus.portal.error.ErrorCode;
import com.campus.portal.error.PortalException;
import com.campus.portal.mapper.AttendanceMapper;
import com.campus.portal.repository.EventFeedbackRepository;
import com.campus.portal.repository.EventRepository;
import com.campus.portal.security.Action;
import com.campus.portal.security.AuthorizationGate;
import com.campus.portal.security.ResourceRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/** Ratings from attendees, one per user and event. */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackService {

    private final EventRepository events;
    private final EventFeedbackRepository feedback;
    private final AuthorizationGate gate;
    private final AttendanceMapper mapper;

    @Transactional
    public FeedbackDTO submit(User actor, Long eventId, FeedbackRequest req) {
        Event event = require(eventId);
        gate.require(actor, Action.SUBMIT_FEEDBACK, ResourceRef.eventSubject(event, actor.getId()));

        boolean attended = event.registrationOf(actor.getId())
                .map(r -> r.getStatus() == RegistrationStatus.ATTENDED)
                .orElse(false);
        if (!attended) {
            throw new PortalException(ErrorCode.NOT_ATTENDED, "user " + actor.getId() + " did not attend event " + eventId);
        }
        if (feedback.existsByEvent_IdAndUser_Id(eventId, actor.getId())) {
            throw new PortalException(ErrorCode.FEEDBACK_ALREADY_SUBMITTED, "feedback already submitted for event " + eventId);
        }

        EventFeedback f = new EventFeedback();
        f.setEvent(event);
        f.setUser(actor);
        f.setRating(req.rating());
        f.setComment(req.comment() == null ? null : req.comment().trim());
        EventFeedback saved = feedback.save(f);

        log.info("user={} rated event={} rating={}", actor.getId(), eventId, req.rating());
        return mapper.toDto(saved);
    }

    @Transactional(readOnly = true)
    public FeedbackSummary list(Long eventId) {
        require(eventId);
        List<FeedbackDTO> items = feedback.findByEvent_IdOrderByCreatedAtDesc(eventId).stream()
                .map(mapper::toDto)
                .toList();
        double avg = items.stream().mapToInt(FeedbackDTO::rating).average().orElse(0);
        // one decimal
        avg = Math.round(avg * 10) / 10.0;
        return new FeedbackSummary(eventId, items.size(), avg, items);
    }

    private Event require(Long eventId) {
        return events.findById(eventId)
                .orElseThrow(() -> new PortalException(ErrorCode.EVENT_NOT_FOUND, "event " + eventId + " not found"));
    }
}
