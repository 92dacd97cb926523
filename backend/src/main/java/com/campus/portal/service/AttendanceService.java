package com.campus.portal.service;

import com.campus.portal.dto.AttendanceRecordDTO;
import com.campus.portal.dto.AttendanceSummary;
import com.campus.portal.dto.ClubAttendanceReport;
import com.campus.portal.entity.AttendanceRecord;
import com.campus.portal.entity.Club;
import com.campus.portal.entity.Event;
import com.campus.portal.entity.EventRegistration;
import com.campus.portal.entity.EventStatus;
import com.campus.portal.entity.RegistrationStatus;
import com.campus.portal.entity.User;
import com.campus.portal.error.ErrorCode;
import com.campus.portal.error.PortalException;
import com.campus.portal.mapper.AttendanceMapper;
import com.campus.portal.repository.AttendanceRecordRepository;
import com.campus.portal.repository.ClubRepository;
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
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceService {

    private final EventRepository events;
    private final ClubRepository clubs;
    private final EventRegistrationRepository registrations;
    private final AttendanceRecordRepository records;
    private final AuthorizationGate gate;
    private final AttendanceMapper mapper;
    private final Clock clock;

    /**
     * Recomputes attendance for the whole roster from {@code presentUserIds}: listed users
     * become attended, every other active registration goes back to registered. The result
     * depends only on the given set, never on earlier calls.
     */
    @Transactional
    public AttendanceSummary markAttendance(User actor, Long eventId, Set<Long> presentUserIds) {
        Event event = lock(eventId);
        gate.require(actor, Action.MARK_ATTENDANCE, ResourceRef.event(event));
        if (event.getStatus() != EventStatus.COMPLETED) {
            throw new PortalException(ErrorCode.EVENT_NOT_COMPLETED, "event " + eventId + " is " + event.getStatus());
        }

        Set<Long> present = presentUserIds == null ? Set.of() : presentUserIds;
        for (Long userId : present) {
            if (event.activeRegistrationOf(userId).isEmpty()) {
                throw new PortalException(ErrorCode.UNKNOWN_PARTICIPANT, "user " + userId + " has no registration for event " + eventId);
            }
        }

        Map<Long, AttendanceRecord> existing = new HashMap<>();
        for (AttendanceRecord r : records.findByEvent_Id(eventId)) {
            existing.put(r.getUser().getId(), r);
        }

        Instant now = clock.instant();
        for (EventRegistration row : event.activeRegistrations()) {
            Long userId = row.getUser().getId();
            if (present.contains(userId)) {
                row.setStatus(RegistrationStatus.ATTENDED);
                // kept records retain their original markedAt
                if (existing.remove(userId) == null) {
                    AttendanceRecord rec = new AttendanceRecord();
                    rec.setEvent(event);
                    rec.setUser(row.getUser());
                    rec.setMarkedBy(actor);
                    rec.setMarkedAt(now);
                    records.save(rec);
                }
            } else {
                row.setStatus(RegistrationStatus.REGISTERED);
            }
        }
        // whatever is left no longer has an attended row behind it
        records.deleteAll(existing.values());
        registrations.saveAll(event.activeRegistrations());
        records.flush();

        AttendanceSummary summary = summarize(event);
        log.info("user={} marked attendance event={} attended={}/{}", actor.getId(), eventId,
                summary.attended(), summary.registered());
        return summary;
    }

    @Transactional(readOnly = true)
    public AttendanceSummary summary(User actor, Long eventId) {
        Event event = events.findById(eventId)
                .orElseThrow(() -> new PortalException(ErrorCode.EVENT_NOT_FOUND, "event " + eventId + " not found"));
        gate.require(actor, Action.VIEW_PARTICIPANTS, ResourceRef.event(event));
        return summarize(event);
    }

    /** Events the user was marked present at, newest first. */
    @Transactional(readOnly = true)
    public List<AttendanceRecordDTO> history(User actor, Long userId) {
        gate.require(actor, Action.VIEW_ATTENDANCE_HISTORY, ResourceRef.subject(userId));
        return mapper.toDtos(records.findByUser_IdOrderByMarkedAtDesc(userId));
    }

    /**
     * Registration and attendance totals for a club's events, newest first, optionally
     * limited to event dates within {@code [from, to]}. Cancelled rows are not counted.
     */
    @Transactional(readOnly = true)
    public ClubAttendanceReport clubReport(User actor, Long clubId, LocalDate from, LocalDate to) {
        Club club = clubs.findById(clubId)
                .orElseThrow(() -> new PortalException(ErrorCode.CLUB_NOT_FOUND, "club " + clubId + " not found"));
        gate.require(actor, Action.VIEW_CLUB_REPORT, ResourceRef.club(club));

        List<Event> inRange = events.findByClub_Id(clubId).stream()
                .filter(e -> from == null || !e.getEventDate().isBefore(from))
                .filter(e -> to == null || !e.getEventDate().isAfter(to))
                .sorted(Comparator.comparing(Event::getEventDate).thenComparing(Event::getStartTime).reversed())
                .toList();

        List<ClubAttendanceReport.EventLine> lines = new ArrayList<>();
        Map<YearMonth, int[]> byMonth = new TreeMap<>();
        int totalRegistered = 0;
        int totalAttended = 0;
        for (Event e : inRange) {
            int registered = e.activeRegistrationCount();
            int attended = attendedCount(e);
            totalRegistered += registered;
            totalAttended += attended;
            lines.add(new ClubAttendanceReport.EventLine(e.getId(), e.getTitle(), e.getEventDate(), e.getVenue(),
                    e.getStatus(), registered, attended, rate(attended, registered)));

            int[] m = byMonth.computeIfAbsent(YearMonth.from(e.getEventDate()), k -> new int[3]);
            m[0]++;
            m[1] += registered;
            m[2] += attended;
        }
        List<ClubAttendanceReport.MonthLine> months = byMonth.entrySet().stream()
                .map(en -> new ClubAttendanceReport.MonthLine(en.getKey().toString(), en.getValue()[0], en.getValue()[1], en.getValue()[2]))
                .toList();

        log.debug("club report club={} events={}", clubId, lines.size());
        return new ClubAttendanceReport(clubId, club.getName(), from, to, lines.size(), totalRegistered, totalAttended,
                rate(totalAttended, totalRegistered), lines, months);
    }

    private AttendanceSummary summarize(Event event) {
        int registered = event.activeRegistrationCount();
        int attended = attendedCount(event);
        int rate = rate(attended, registered);

        List<AttendanceRecord> marked = records.findByEvent_Id(event.getId()).stream()
                .sorted(Comparator.comparing((AttendanceRecord r) -> r.getUser().getId()))
                .toList();
        return new AttendanceSummary(event.getId(), registered, attended, registered - attended, rate, mapper.toDtos(marked));
    }

    private static int attendedCount(Event event) {
        return (int) event.getRegistrations().stream()
                .filter(r -> r.getStatus() == RegistrationStatus.ATTENDED)
                .count();
    }

    private static int rate(int attended, int registered) {
        return registered == 0 ? 0 : Math.round(attended * 100f / registered);
    }

    private Event lock(Long eventId) {
        return events.findByIdForUpdate(eventId)
                .orElseThrow(() -> new PortalException(ErrorCode.EVENT_NOT_FOUND, "event " + eventId + " not found"));
    }
}
