package com.campus.portal.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Entity
@Data
@Table(
        name = "clubs",
        uniqueConstraints = @UniqueConstraint(columnNames = {"name"}),
        indexes = {
                @Index(columnList = "category,active"),
                @Index(columnList = "coordinator_id")
        }
)
public class Club {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ClubCategory category;

    @Column(length = 256)
    private String contactEmail;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "coordinator_id", nullable = false)
    private User coordinator;

    // full history, inactive rows included
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @OneToMany(mappedBy = "club", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("joinedAt ASC, id ASC")
    private List<ClubMembership> members = new ArrayList<>();

    @Column(nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    public Optional<ClubMembership> activeMembership(Long userId) {
        return members.stream()
                .filter(ClubMembership::isActive)
                .filter(m -> Objects.equals(m.getUser().getId(), userId))
                .findFirst();
    }

    public List<ClubMembership> activeMembers() {
        return members.stream().filter(ClubMembership::isActive).toList();
    }

    public int activeMemberCount() {
        return (int) members.stream().filter(ClubMembership::isActive).count();
    }

    public boolean isCoordinator(Long userId) {
        return coordinator != null && Objects.equals(coordinator.getId(), userId);
    }

    /** Coordinator, or an active leader/coordinator member. */
    public boolean hasAuthority(Long userId) {
        if (isCoordinator(userId)) return true;
        return activeMembership(userId)
                .map(m -> m.getRole().isAuthority())
                .orElse(false);
    }
}
