package com.campus.portal.security;

import com.campus.portal.entity.Club;
import com.campus.portal.entity.EventStatus;
import com.campus.portal.entity.Role;
import com.campus.portal.entity.User;
import com.campus.portal.error.PermissionDeniedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Role policy for every portal mutation. {@link #authorize} is a pure decision:
 * it reads the actor and the resource and never touches storage.
 * <p>
 * Rules, first match wins: admins may do anything; club and event management needs a
 * teacher with authority over the club; attendance needs a teacher and a completed event;
 * roster actions (join, leave, register, cancel, feedback) are self-only.
 * <p>
 * Roles are compared here and nowhere else.
 */
@Slf4j
@Component
public class AuthorizationGate {

    public Decision authorize(User actor, Action action, ResourceRef resource) {
        if (actor == null) return Decision.deny(Decision.UNAUTHENTICATED);
        if (!actor.isActive()) return Decision.deny(Decision.INACTIVE_ACCOUNT);
        if (actor.getRole() == Role.ADMIN) return Decision.allow();

        ResourceRef res = resource == null ? ResourceRef.none() : resource;
        boolean teacher = actor.getRole() == Role.TEACHER;

        return switch (action.rule()) {
            case ADMIN_ONLY -> Decision.deny(Decision.INSUFFICIENT_ROLE);
            case CLUB_AUTHORITY -> {
                if (!teacher) yield Decision.deny(Decision.INSUFFICIENT_ROLE);
                Club club = res.club();
                if (club == null) yield Decision.deny(Decision.MISSING_RESOURCE);
                yield club.hasAuthority(actor.getId())
                        ? Decision.allow()
                        : Decision.deny(Decision.NOT_CLUB_AUTHORITY);
            }
            case ATTENDANCE -> {
                if (!teacher) yield Decision.deny(Decision.INSUFFICIENT_ROLE);
                if (res.event() == null) yield Decision.deny(Decision.MISSING_RESOURCE);
                yield res.event().getStatus() == EventStatus.COMPLETED
                        ? Decision.allow()
                        : Decision.deny(Decision.EVENT_NOT_COMPLETED);
            }
            case SELF -> isSelf(actor, res)
                    ? Decision.allow()
                    : Decision.deny(Decision.SELF_ONLY);
            case SELF_OR_STAFF -> teacher || isSelf(actor, res)
                    ? Decision.allow()
                    : Decision.deny(Decision.SELF_ONLY);
            case STAFF -> teacher
                    ? Decision.allow()
                    : Decision.deny(Decision.INSUFFICIENT_ROLE);
        };
    }

    /**
     * Same decision as {@link #authorize}, as a precondition: a denial is logged
     * and raised before the caller runs any domain check.
     */
    public void require(User actor, Action action, ResourceRef resource) {
        Decision d = authorize(actor, action, resource);
        if (!d.allowed()) {
            log.warn("denied {} for user={} reason={}", action, actor == null ? null : actor.getId(), d.reason());
            throw new PermissionDeniedException(action, d.reason());
        }
    }

    /** Only teachers and admins can hold a club's coordinator slot. */
    public boolean canCoordinate(User user) {
        return user != null && user.isActive()
                && (user.getRole() == Role.TEACHER || user.getRole() == Role.ADMIN);
    }

    private boolean isSelf(User actor, ResourceRef res) {
        return res.subjectUserId() != null && Objects.equals(actor.getId(), res.subjectUserId());
    }
}
