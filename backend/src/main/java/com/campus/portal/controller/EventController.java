package com.campus.portal.controller;

import com.campus.portal.dto.CreateEventRequest;
import com.campus.portal.dto.DuplicateEventRequest;
import com.campus.portal.dto.EventDTO;
import com.campus.portal.dto.FeedbackDTO;
import com.campus.portal.dto.FeedbackRequest;
import com.campus.portal.dto.FeedbackSummary;
import com.campus.portal.dto.RegistrationDTO;
import com.campus.portal.dto.StatusChangeRequest;
import com.campus.portal.dto.UpdateEventRequest;
import com.campus.portal.entity.EventStatus;
import com.campus.portal.entity.User;
import com.campus.portal.service.EventService;
import com.campus.portal.service.FeedbackService;
import com.campus.portal.service.RegistrationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final EventService events;
    private final RegistrationService registrations;
    private final FeedbackService feedback;
    private final CurrentUser currentUser;

    @GetMapping
    public Page<EventDTO> list(
            @RequestParam(required = false) Long clubId,
            @RequestParam(required = false) EventStatus status,
            @RequestParam(required = false) String q,
            Pageable pageable
    ) {
        return events.list(clubId, status, q, pageable);
    }

    @GetMapping("/upcoming")
    public List<EventDTO> upcoming(@RequestParam(defaultValue = "10") int limit) {
        return events.upcoming(limit);
    }

    @GetMapping("/{id}")
    public EventDTO get(@PathVariable Long id) {
        return events.get(id);
    }

    @PostMapping
    public ResponseEntity<EventDTO> create(@Valid @RequestBody CreateEventRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(events.create(currentUser.require(), req));
    }

    @PutMapping("/{id}")
    public EventDTO update(@PathVariable Long id, @Valid @RequestBody UpdateEventRequest req) {
        return events.update(currentUser.require(), id, req);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        events.delete(currentUser.require(), id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/duplicate")
    public ResponseEntity<EventDTO> duplicate(@PathVariable Long id, @Valid @RequestBody DuplicateEventRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(events.duplicate(currentUser.require(), id, req));
    }

    @PutMapping("/{id}/status")
    public EventDTO status(@PathVariable Long id, @Valid @RequestBody StatusChangeRequest req) {
        return events.advanceStatus(currentUser.require(), id, req.status());
    }

    /** {@code userId} defaults to the caller. */
    @PostMapping("/{id}/register")
    public ResponseEntity<RegistrationDTO> register(@PathVariable Long id, @RequestParam(required = false) Long userId) {
        User actor = currentUser.require();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(registrations.register(actor, id, userId == null ? actor.getId() : userId));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable Long id, @RequestParam(required = false) Long userId) {
        User actor = currentUser.require();
        registrations.cancel(actor, id, userId == null ? actor.getId() : userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/participants")
    public List<RegistrationDTO> participants(@PathVariable Long id) {
        return events.participants(currentUser.require(), id);
    }

    @PostMapping("/{id}/feedback")
    public ResponseEntity<FeedbackDTO> submitFeedback(@PathVariable Long id, @Valid @RequestBody FeedbackRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(feedback.submit(currentUser.require(), id, req));
    }

    @GetMapping("/{id}/feedback")
    public FeedbackSummary feedback(@PathVariable Long id) {
        return feedback.list(id);
    }
}
