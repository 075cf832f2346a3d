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
 * A user's seat at an event. At most one non-cancelled registration exists per (event, user);
 * the database enforces it with a partial unique index.
 */
@Entity
@Table(name = "registrations", indexes = {
        @Index(name = "idx_registrations_event", columnList = "event_id"),
        @Index(name = "idx_registrations_user", columnList = "user_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Registration {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "event_id", nullable = false)
    private UUID eventId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RegistrationStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    /** Minor currency units. */
    @Column(name = "payment_amount", nullable = false)
    private long paymentAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", length = 20)
    private PaymentMethod paymentMethod;

    @Column(name = "refund_requested", nullable = false)
    private boolean refundRequested;

    @Column(name = "certificate_issued", nullable = false)
    private boolean certificateIssued;

    @Column(name = "certificate_issued_at")
    private Instant certificateIssuedAt;

    @Column(name = "attended", nullable = false)
    private boolean attended;

    @Column(name = "attended_at")
    private Instant attendedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isActive() {
        return status != RegistrationStatus.CANCELLED;
    }
}
