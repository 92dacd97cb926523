package com.campus.portal.service;

import com.campus.portal.dto.ClubDTO;
import com.campus.portal.dto.MembershipDTO;
import com.campus.portal.entity.Club;
import com.campus.portal.entity.ClubMembership;
import com.campus.portal.entity.MembershipRole;
import com.campus.portal.entity.User;
import com.campus.portal.error.ErrorCode;
import com.campus.portal.error.PortalException;
import com.campus.portal.mapper.ClubMapper;
import com.campus.portal.repository.ClubRepository;
import com.campus.portal.security.Action;
import com.campus.portal.security.AuthorizationGate;
import com.campus.portal.security.ResourceRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Club rosters: join, leave, role changes and the coordinator slot.
 * Every mutation holds the club row lock until commit, so two requests for the
 * same club never interleave.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipService {

    private final ClubRepository clubs;
    private final UserService userService;
    private final AuthorizationGate gate;
    private final ClubMapper mapper;
    private final Clock clock;

    @Transactional
    public MembershipDTO join(User actor, Long clubId, Long userId) {
        Club club = lock(clubId);
        gate.require(actor, Action.JOIN_CLUB, ResourceRef.clubSubject(club, userId));

        if (club.activeMembership(userId).isPresent()) {
            throw new PortalException(ErrorCode.ALREADY_MEMBER, "user " + userId + " is already a member of this club");
        }
        if (!club.isActive()) {
            throw new PortalException(ErrorCode.CLUB_INACTIVE, "club " + clubId + " is not active");
        }

        ClubMembership m = new ClubMembership();
        m.setClub(club);
        m.setUser(userService.require(userId));
        m.setRole(MembershipRole.MEMBER);
        m.setJoinedAt(clock.instant());
        m.setActive(true);
        club.getMembers().add(m);
        clubs.saveAndFlush(club);

        log.info("user={} joined club={} members={}", userId, clubId, club.activeMemberCount());
        return mapper.toDto(m);
    }

    /** Soft removal; the row stays for history. The coordinator slot is not touched. */
    @Transactional
    public void leave(User actor, Long clubId, Long userId) {
        Club club = lock(clubId);
        gate.require(actor, Action.LEAVE_CLUB, ResourceRef.clubSubject(club, userId));

        ClubMembership m = club.activeMembership(userId)
                .orElseThrow(() -> new PortalException(ErrorCode.NOT_A_MEMBER, "user " + userId + " is not a member of this club"));
        m.setActive(false);
        clubs.save(club);

        log.info("user={} left club={} members={}", userId, clubId, club.activeMemberCount());
    }

    /**
     * Member/leader changes update the row. Promoting to coordinator hands over the
     * club's coordinator slot instead and leaves the previous coordinator's rows as they are.
     * Either way the target must hold an active membership.
     */
    @Transactional
    public ClubDTO promote(User actor, Long clubId, Long userId, MembershipRole newRole) {
        Club club = lock(clubId);
        Action action = newRole == MembershipRole.COORDINATOR ? Action.SET_COORDINATOR : Action.PROMOTE_MEMBER;
        gate.require(actor, action, ResourceRef.clubSubject(club, userId));

        ClubMembership m = club.activeMembership(userId)
                .orElseThrow(() -> new PortalException(ErrorCode.NOT_A_MEMBER, "user " + userId + " is not a member of this club"));
        if (newRole == MembershipRole.COORDINATOR) {
            return handOver(actor, club, m.getUser());
        }
        MembershipRole previous = m.getRole();
        m.setRole(newRole);
        clubs.save(club);

        log.info("user={} changed role of user={} in club={} {} -> {}", actor.getId(), userId, clubId, previous, newRole);
        return mapper.toDto(club);
    }

    /** Admin reassignment of the coordinator slot; the new coordinator need not be a member. */
    @Transactional
    public ClubDTO setCoordinator(User actor, Long clubId, Long userId) {
        Club club = lock(clubId);
        gate.require(actor, Action.SET_COORDINATOR, ResourceRef.clubSubject(club, userId));
        return handOver(actor, club, userService.require(userId));
    }

    /** Active roster snapshot, in join order. */
    @Transactional(readOnly = true)
    public List<MembershipDTO> members(Long clubId) {
        Club club = clubs.findById(clubId)
                .orElseThrow(() -> new PortalException(ErrorCode.CLUB_NOT_FOUND, "club " + clubId + " not found"));
        return mapper.toMembershipDtos(club.activeMembers());
    }

    @Transactional(readOnly = true)
    public List<ClubDTO> clubsOf(Long userId) {
        return clubs.findActiveClubsOfUser(userId).stream().map(mapper::toDto).toList();
    }

    private ClubDTO handOver(User actor, Club club, User coordinator) {
        if (!gate.canCoordinate(coordinator)) {
            throw new PortalException(ErrorCode.INVALID_COORDINATOR, "coordinator must be an active teacher or admin");
        }
        Long previous = club.getCoordinator().getId();
        club.setCoordinator(coordinator);
        clubs.save(club);

        log.info("user={} set coordinator of club={} {} -> {}", actor.getId(), club.getId(), previous, coordinator.getId());
        return mapper.toDto(club);
    }

    private Club lock(Long clubId) {
        return clubs.findByIdForUpdate(clubId)
                .orElseThrow(() -> new PortalException(ErrorCode.CLUB_NOT_FOUND, "club " + clubId + " not found"));
    }
}
