package com.campus.portal.controller;

import com.campus.portal.dto.AttendanceRecordDTO;
import com.campus.portal.dto.AttendanceRequest;
import com.campus.portal.dto.AttendanceSummary;
import com.campus.portal.dto.ClubAttendanceReport;
import com.campus.portal.service.AttendanceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/attendance")
@RequiredArgsConstructor
public class AttendanceController {

    private final AttendanceService attendance;
    private final CurrentUser currentUser;

    @PostMapping("/events/{eventId}")
    public AttendanceSummary mark(@PathVariable Long eventId, @Valid @RequestBody AttendanceRequest req) {
        return attendance.markAttendance(currentUser.require(), eventId, req.presentUserIds());
    }

    @GetMapping("/events/{eventId}")
    public AttendanceSummary summary(@PathVariable Long eventId) {
        return attendance.summary(currentUser.require(), eventId);
    }

    @GetMapping("/users/{userId}")
    public List<AttendanceRecordDTO> history(@PathVariable Long userId) {
        return attendance.history(currentUser.require(), userId);
    }

    @GetMapping("/reports/clubs/{clubId}")
    public ClubAttendanceReport clubReport(
            @PathVariable Long clubId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return attendance.clubReport(currentUser.require(), clubId, from, to);
    }
}
