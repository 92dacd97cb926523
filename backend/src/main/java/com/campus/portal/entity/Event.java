package com.campus.portal.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Entity
@Data
@Table(
        name = "events",
        indexes = {
                @Index(columnList = "club_id,eventDate"),
                @Index(columnList = "status"),
                @Index(columnList = "registrationDeadline")
        }
)
public class Event {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, length = 5000)
    private String description;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "club_id", nullable = false)
    private Club club;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "organizer_id")
    private User organizer;

    @Column(nullable = false)
    private LocalDate eventDate;

    @Column(nullable = false)
    private LocalTime startTime;

    @Column(nullable = false)
    private LocalTime endTime;

    @Column(nullable = false, length = 200)
    private String venue;

    // 0 = unlimited
    @Column(nullable = false)
    private int maxParticipants;

    @Column(nullable = false)
    private Instant registrationDeadline;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EventStatus status = EventStatus.UPCOMING;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @OneToMany(mappedBy = "event", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<EventRegistration> registrations = new ArrayList<>();

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    /** Any row for the user, cancelled ones included. */
    public Optional<EventRegistration> registrationOf(Long userId) {
        return registrations.stream()
                .filter(r -> Objects.equals(r.getUser().getId(), userId))
                .findFirst();
    }

    public Optional<EventRegistration> activeRegistrationOf(Long userId) {
        return registrationOf(userId).filter(r -> r.getStatus().isActive());
    }

    public List<EventRegistration> activeRegistrations() {
        return registrations.stream().filter(r -> r.getStatus().isActive()).toList();
    }

    public int activeRegistrationCount() {
        return (int) registrations.stream().filter(r -> r.getStatus().isActive()).count();
    }

    public boolean isUnlimited() {
        return maxParticipants <= 0;
    }

    public boolean isFull() {
        return !isUnlimited() && activeRegistrationCount() >= maxParticipants;
    }

    public Integer availableSpots() {
        if (isUnlimited()) return null;
        return Math.max(0, maxParticipants - activeRegistrationCount());
    }

    public boolean isRegistrationOpen(Instant now) {
        return status == EventStatus.UPCOMING && !now.isAfter(registrationDeadline) && !isFull();
    }

    public Instant startsAt(ZoneId zone) {
        return eventDate.atTime(startTime).atZone(zone).toInstant();
    }

    public Instant endsAt(ZoneId zone) {
        return eventDate.atTime(endTime).atZone(zone).toInstant();
    }
}
