package com.campus.portal.controller;

import com.campus.portal.dto.ClubDTO;
import com.campus.portal.dto.ClubStatsDTO;
import com.campus.portal.dto.CoordinatorRequest;
import com.campus.portal.dto.CreateClubRequest;
import com.campus.portal.dto.MembershipDTO;
import com.campus.portal.dto.RoleChangeRequest;
import com.campus.portal.dto.UpdateClubRequest;
import com.campus.portal.entity.ClubCategory;
import com.campus.portal.entity.User;
import com.campus.portal.service.ClubService;
import com.campus.portal.service.MembershipService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/clubs")
@RequiredArgsConstructor
public class ClubController {

    private final ClubService clubs;
    private final MembershipService memberships;
    private final CurrentUser currentUser;

    @GetMapping
    public Page<ClubDTO> list(
            @RequestParam(required = false) ClubCategory category,
            @RequestParam(required = false) String q,
            Pageable pageable
    ) {
        return clubs.list(category, q, pageable);
    }

    @GetMapping("/{id}")
    public ClubDTO get(@PathVariable Long id) {
        return clubs.get(id);
    }

    @GetMapping("/{id}/members")
    public List<MembershipDTO> members(@PathVariable Long id) {
        return memberships.members(id);
    }

    @GetMapping("/{id}/stats")
    public ClubStatsDTO stats(@PathVariable Long id) {
        return clubs.stats(id);
    }

    @PostMapping
    public ResponseEntity<ClubDTO> create(@Valid @RequestBody CreateClubRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(clubs.create(currentUser.require(), req));
    }

    @PutMapping("/{id}")
    public ClubDTO update(@PathVariable Long id, @Valid @RequestBody UpdateClubRequest req) {
        return clubs.update(currentUser.require(), id, req);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, @RequestParam(defaultValue = "false") boolean hard) {
        clubs.delete(currentUser.require(), id, hard);
        return ResponseEntity.noContent().build();
    }

    /** {@code userId} defaults to the caller. */
    @PostMapping("/{id}/join")
    public ResponseEntity<MembershipDTO> join(@PathVariable Long id, @RequestParam(required = false) Long userId) {
        User actor = currentUser.require();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(memberships.join(actor, id, userId == null ? actor.getId() : userId));
    }

    @PostMapping("/{id}/leave")
    public ResponseEntity<Void> leave(@PathVariable Long id, @RequestParam(required = false) Long userId) {
        User actor = currentUser.require();
        memberships.leave(actor, id, userId == null ? actor.getId() : userId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{id}/members/{userId}/role")
    public ClubDTO changeRole(@PathVariable Long id, @PathVariable Long userId, @Valid @RequestBody RoleChangeRequest req) {
        return memberships.promote(currentUser.require(), id, userId, req.role());
    }

    @PutMapping("/{id}/coordinator")
    public ClubDTO coordinator(@PathVariable Long id, @Valid @RequestBody CoordinatorRequest req) {
        return memberships.setCoordinator(currentUser.require(), id, req.userId());
    }
}
