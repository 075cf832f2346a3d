package com.unievents.event.domain.model;

import com.unievents.event.domain.model.payload.EventPayload;
import com.unievents.event.domain.model.payload.EventPayloadConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Event aggregate: common columns plus a type-tagged payload.
 *
 * registeredCount is only ever changed through the guarded UPDATE statements in
 * {@code EventRepository} (or under a row lock by the pessimistic strategy). @DynamicUpdate keeps
 * ordinary entity saves, e.g. status transitions, from writing a stale count back.
 */
@Entity
@DynamicUpdate
@Table(name = "events", indexes = {
        @Index(name = "idx_events_status", columnList = "status"),
        @Index(name = "idx_events_start_date", columnList = "start_date"),
        @Index(name = "idx_events_created_by", columnList = "created_by")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private EventType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EventStatus status;

    @Column(name = "archived", nullable = false)
    private boolean archived;

    @Column(name = "location")
    private String location;

    @Column(name = "start_date", nullable = false)
    private Instant startDate;

    @Column(name = "end_date", nullable = false)
    private Instant endDate;

    /** Null means unlimited. */
    @Column(name = "capacity")
    private Integer capacity;

    @Builder.Default
    @Column(name = "registered_count", nullable = false)
    private int registeredCount = 0;

    @Column(name = "registration_deadline")
    private Instant registrationDeadline;

    /** Minor currency units. */
    @Builder.Default
    @Column(name = "price", nullable = false)
    private long price = 0L;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "event_restricted_roles", joinColumns = @JoinColumn(name = "event_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private Set<UserRole> restrictedTo = new HashSet<>();

    @Column(name = "rejection_reason", length = 2000)
    private String rejectionReason;

    @Convert(converter = EventPayloadConverter.class)
    @Column(name = "payload", columnDefinition = "TEXT")
    private EventPayload payload;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (status == null) {
            status = EventStatus.DRAFT;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean hasCapacityLimit() {
        return capacity != null;
    }

    public boolean isFull() {
        return capacity != null && registeredCount >= capacity;
    }

    public boolean isPaid() {
        return price > 0;
    }

    public boolean isRestricted() {
        return restrictedTo != null && !restrictedTo.isEmpty();
    }

    /**
     * Used by the pessimistic strategy only, while the row is locked.
     */
    public void incrementRegisteredCount() {
        if (isFull()) {
            throw new IllegalStateException("Event " + id + " is at capacity");
        }
        this.registeredCount += 1;
    }
}
