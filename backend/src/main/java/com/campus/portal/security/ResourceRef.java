package com.campus.portal.security;

import com.campus.portal.entity.Club;
import com.campus.portal.entity.Event;

/**
 * What an action is performed on. Any part may be null when the action
 * does not need it; {@code subjectUserId} is the user the action is on behalf of.
 */
public record ResourceRef(Club club, Event event, Long subjectUserId) {

    public static ResourceRef none() {
        return new ResourceRef(null, null, null);
    }

    public static ResourceRef club(Club club) {
        return new ResourceRef(club, null, null);
    }

    public static ResourceRef event(Event event) {
        return new ResourceRef(event.getClub(), event, null);
    }

    public static ResourceRef subject(Long userId) {
        return new ResourceRef(null, null, userId);
    }

    public static ResourceRef clubSubject(Club club, Long userId) {
        return new ResourceRef(club, null, userId);
    }

    public static ResourceRef eventSubject(Event event, Long userId) {
        return new ResourceRef(event.getClub(), event, userId);
    }
}
