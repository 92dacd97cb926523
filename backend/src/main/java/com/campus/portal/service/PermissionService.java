package com.campus.portal.service;

import com.campus.portal.entity.Club;
import com.campus.portal.entity.Event;
import com.campus.portal.entity.User;
import com.campus.portal.error.ErrorCode;
import com.campus.portal.error.PortalException;
import com.campus.portal.repository.ClubRepository;
import com.campus.portal.repository.EventRepository;
import com.campus.portal.security.Action;
import com.campus.portal.security.AuthorizationGate;
import com.campus.portal.security.Decision;
import com.campus.portal.security.ResourceRef;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Answers "may I?" for clients that want to show or hide an action. */
@Service
@RequiredArgsConstructor
public class PermissionService {

    private final ClubRepository clubs;
    private final EventRepository events;
    private final AuthorizationGate gate;

    @Transactional(readOnly = true)
    public Decision check(User actor, Action action, Long clubId, Long eventId, Long subjectUserId) {
        Event event = null;
        Club club = null;
        if (eventId != null) {
            event = events.findById(eventId)
                    .orElseThrow(() -> new PortalException(ErrorCode.EVENT_NOT_FOUND, "event " + eventId + " not found"));
            club = event.getClub();
        } else if (clubId != null) {
            club = clubs.findById(clubId)
                    .orElseThrow(() -> new PortalException(ErrorCode.CLUB_NOT_FOUND, "club " + clubId + " not found"));
        }
        return gate.authorize(actor, action, new ResourceRef(club, event, subjectUserId));
    }
}
