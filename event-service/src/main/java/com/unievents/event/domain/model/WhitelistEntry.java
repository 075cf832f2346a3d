package com.unievents.event.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Additive access grant on a restricted event, either for one user or for a whole role.
 * Exactly one of userId and role is set.
 */
@Entity
@Table(name = "whitelist_entries", indexes = {
        @Index(name = "idx_whitelist_event", columnList = "event_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WhitelistEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "event_id", nullable = false)
    private UUID eventId;

    @Column(name = "user_id")
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", length = 20)
    private UserRole role;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public static WhitelistEntry forUser(UUID eventId, UUID userId, UUID grantedBy) {
        return WhitelistEntry.builder().eventId(eventId).userId(userId).createdBy(grantedBy).build();
    }

    public static WhitelistEntry forRole(UUID eventId, UserRole role, UUID grantedBy) {
        return WhitelistEntry.builder().eventId(eventId).role(role).createdBy(grantedBy).build();
    }
}
