package com.campus.portal.service;

import com.campus.portal.dto.ClubDTO;
import com.campus.portal.dto.ClubStatsDTO;
import com.campus.portal.dto.CreateClubRequest;
import com.campus.portal.dto.UpdateClubRequest;
import com.campus.portal.entity.Club;
import com.campus.portal.entity.ClubCategory;
import com.campus.portal.entity.Event;
import com.campus.portal.entity.EventStatus;
import com.campus.portal.entity.RegistrationStatus;
import com.campus.portal.entity.User;
import com.campus.portal.error.ErrorCode;
import com.campus.portal.error.PortalException;
import com.campus.portal.mapper.ClubMapper;
import com.campus.portal.repository.ClubRepository;
import com.campus.portal.repository.ClubSpecs;
import com.campus.portal.repository.EventRepository;
import com.campus.portal.security.Action;
import com.campus.portal.security.AuthorizationGate;
import com.campus.portal.security.ResourceRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClubService {

    private final ClubRepository clubs;
    private final EventRepository events;
    private final EventService eventService;
    private final UserService userService;
    private final AuthorizationGate gate;
    private final ClubMapper mapper;

    @Transactional
    public ClubDTO create(User actor, CreateClubRequest req) {
        gate.require(actor, Action.CREATE_CLUB, ResourceRef.none());

        String name = req.name().trim();
        if (clubs.existsByNameIgnoreCase(name)) {
            throw new PortalException(ErrorCode.DUPLICATE_CLUB_NAME, "club name already taken: " + name);
        }
        User coordinator = userService.require(req.coordinatorId());
        if (!gate.canCoordinate(coordinator)) {
            throw new PortalException(ErrorCode.INVALID_COORDINATOR, "coordinator must be an active teacher or admin");
        }

        Club c = new Club();
        c.setName(name);
        c.setDescription(req.description().trim());
        c.setCategory(req.category());
        c.setContactEmail(req.contactEmail());
        c.setCoordinator(coordinator);
        c.setActive(true);
        Club saved = clubs.save(c);

        log.info("user={} created club={} '{}' coordinator={}", actor.getId(), saved.getId(), name, coordinator.getId());
        return mapper.toDto(saved);
    }

    @Transactional
    public ClubDTO update(User actor, Long clubId, UpdateClubRequest req) {
        Club club = require(clubId);
        gate.require(actor, Action.UPDATE_CLUB, ResourceRef.club(club));

        if (req.name() != null && clubs.existsByNameIgnoreCaseAndIdNot(req.name().trim(), clubId)) {
            throw new PortalException(ErrorCode.DUPLICATE_CLUB_NAME, "club name already taken: " + req.name());
        }
        mapper.update(req, club);
        club.setName(club.getName().trim());

        log.info("user={} updated club={}", actor.getId(), clubId);
        return mapper.toDto(clubs.save(club));
    }

    /**
     * Soft delete flips the club inactive: it disappears from listings and accepts no
     * new members. Hard delete removes the club together with its events.
     */
    @Transactional
    public void delete(User actor, Long clubId, boolean hard) {
        Club club = require(clubId);
        gate.require(actor, Action.DELETE_CLUB, ResourceRef.club(club));

        if (!hard) {
            club.setActive(false);
            clubs.save(club);
            log.info("user={} deactivated club={}", actor.getId(), clubId);
            return;
        }
        for (Event e : events.findByClub_Id(clubId)) {
            eventService.purge(e);
        }
        clubs.delete(club);
        log.info("user={} deleted club={}", actor.getId(), clubId);
    }

    @Transactional(readOnly = true)
    public ClubDTO get(Long clubId) {
        return mapper.toDto(require(clubId));
    }

    @Transactional(readOnly = true)
    public Page<ClubDTO> list(ClubCategory category, String q, Pageable pageable) {
        Specification<Club> spec = ClubSpecs.isActive()
                .and(ClubSpecs.hasCategory(category))
                .and(ClubSpecs.textLike(q));
        return clubs.findAll(spec, pageable).map(mapper::toDto);
    }

    /** Counts are derived from the rosters on every call; nothing is cached. */
    @Transactional(readOnly = true)
    public ClubStatsDTO stats(Long clubId) {
        Club club = require(clubId);
        List<Event> clubEvents = events.findByClub_Id(clubId);

        int completed = 0;
        int attendanceTotal = 0;
        int withAttendance = 0;
        for (Event e : clubEvents) {
            if (e.getStatus() != EventStatus.COMPLETED) continue;
            completed++;
            int attended = (int) e.getRegistrations().stream()
                    .filter(r -> r.getStatus() == RegistrationStatus.ATTENDED)
                    .count();
            if (attended > 0) {
                attendanceTotal += attended;
                withAttendance++;
            }
        }
        int average = withAttendance == 0 ? 0 : Math.round((float) attendanceTotal / withAttendance);

        return new ClubStatsDTO(
                clubId,
                club.activeMemberCount(),
                club.getMembers().size(),
                clubEvents.size(),
                completed,
                average
        );
    }

    Club require(Long clubId) {
        return clubs.findById(clubId)
                .orElseThrow(() -> new PortalException(ErrorCode.CLUB_NOT_FOUND, "club " + clubId + " not found"));
    }
}
