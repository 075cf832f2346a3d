package com.unievents.event.domain.service;

import com.unievents.common.exception.BusinessException;
import com.unievents.common.exception.ConflictException;
import com.unievents.common.exception.ForbiddenException;
import com.unievents.common.exception.ResourceNotFoundException;
import com.unievents.event.api.dto.RegisterRequest;
import com.unievents.event.api.dto.RegistrationResponse;
import com.unievents.event.domain.access.AccessControlResolver;
import com.unievents.event.domain.access.AccessDecision;
import com.unievents.event.domain.exception.EventErrorCodes;
import com.unievents.event.domain.model.Actor;
import com.unievents.event.domain.model.Event;
import com.unievents.event.domain.model.EventStatus;
import com.unievents.event.domain.model.PaymentStatus;
import com.unievents.event.domain.model.Registration;
import com.unievents.event.domain.model.RegistrationStatus;
import com.unievents.event.domain.model.UserAccount;
import com.unievents.event.domain.repository.EventRepository;
import com.unievents.event.domain.repository.RegistrationRepository;
import com.unievents.event.domain.repository.UserAccountRepository;
import com.unievents.event.domain.strategy.CapacityStrategy;
import com.unievents.event.events.RefundRequestedEvent;
import com.unievents.event.events.RegistrationCreatedEvent;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Registers users for events and cancels registrations, keeping the event's registeredCount exact.
 *
 * The seat itself is taken by a {@link CapacityStrategy}. Spring injects every strategy bean into
 * the map keyed by bean name; events.registration.capacity-strategy picks one:
 * atomic (default) | distributed | pessimistic | optimistic.
 *
 * Everything happens in one transaction: if saving the registration fails after the seat was taken
 * (e.g. a duplicate slipped past the pre-check and hit the unique index), the rollback gives the
 * seat back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationEngine {

    private static final String DEFAULT_STRATEGY = "atomic";

    private final Map<String, CapacityStrategy> capacityStrategies;
    private final EventRepository eventRepository;
    private final RegistrationRepository registrationRepository;
    private final UserAccountRepository userAccountRepository;
    private final AccessControlResolver accessControlResolver;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${events.registration.capacity-strategy:atomic}")
    private String strategyType;

    /** Registrants may only cancel up to this many days before the event starts. */
    @Value("${events.registration.cancellation-lead-days:14}")
    private long cancellationLeadDays = 14;

    @PostConstruct
    public void init() {
        log.info("Initialized RegistrationEngine with capacity strategy: {}", getCapacityStrategy().getStrategyType());
    }

    @Transactional
    public RegistrationResponse register(RegisterRequest request) {
        UUID eventId = request.eventId();
        UUID userId = request.userId();
        log.info("Registering user {} for event {}", userId, eventId);

        Event event = eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
        if (event.getStatus() != EventStatus.PUBLISHED || event.isArchived()) {
            throw new ConflictException(
                    String.format("Event %s is not open for registration (status %s%s)",
                            eventId, event.getStatus(), event.isArchived() ? ", archived" : ""),
                    EventErrorCodes.EVENT_NOT_REGISTRABLE);
        }

        Instant now = clock.instant();
        if (event.getRegistrationDeadline() != null && now.isAfter(event.getRegistrationDeadline())) {
            throw new ConflictException("Registration deadline has passed", EventErrorCodes.DEADLINE_PASSED);
        }
        if (!now.isBefore(event.getStartDate())) {
            throw new ConflictException("Event has already started", EventErrorCodes.DEADLINE_PASSED);
        }

        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
        AccessDecision decision = accessControlResolver.evaluate(event, user);
        if (!decision.granted()) {
            throw new ConflictException(
                    decision == AccessDecision.DENIED_INACTIVE_USER
                            ? "User account is not active"
                            : "Event is restricted and the user is not whitelisted",
                    EventErrorCodes.NOT_WHITELISTED);
        }

        if (registrationRepository.existsByEventIdAndUserIdAndStatusNot(eventId, userId, RegistrationStatus.CANCELLED)) {
            throw new ConflictException("User is already registered for this event", EventErrorCodes.ALREADY_REGISTERED);
        }

        if (event.isPaid() && request.paymentMethod() == null) {
            throw new BusinessException("Payment method is required for paid events", EventErrorCodes.VALIDATION_ERROR);
        }

        getCapacityStrategy().acquireSeat(eventId);

        Registration registration = Registration.builder()
                .eventId(eventId)
                .userId(userId)
                .status(event.isPaid() ? RegistrationStatus.PENDING : RegistrationStatus.CONFIRMED)
                .paymentStatus(event.isPaid() ? PaymentStatus.PENDING : PaymentStatus.COMPLETED)
                .paymentAmount(event.getPrice())
                .paymentMethod(event.isPaid() ? request.paymentMethod() : null)
                .createdAt(now)
                .build();

        try {
            registration = registrationRepository.saveAndFlush(registration);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent duplicate registration of user {} for event {}", userId, eventId);
            throw new ConflictException("User is already registered for this event", e, EventErrorCodes.ALREADY_REGISTERED);
        }

        eventPublisher.publishEvent(RegistrationCreatedEvent.of(registration, now));
        log.info("Registration {} created ({}/{})", registration.getId(), registration.getStatus(), registration.getPaymentStatus());
        return RegistrationResponse.from(registration);
    }

    /**
     * Cancels a registration and gives its seat back. A completed payment is flipped to REFUNDED
     * and one RefundRequested fact is raised; the refundRequested flag makes that exactly once.
     *
     * Registrants cannot cancel once the event has started or inside the cancellation lead time
     * before it. Event Office is not bound by either rule.
     */
    @Transactional
    public RegistrationResponse cancel(UUID registrationId, Actor actor) {
        Registration registration = registrationRepository.findByIdForUpdate(registrationId)
                .orElseThrow(() -> new ResourceNotFoundException("Registration", registrationId));

        if (registration.getStatus() == RegistrationStatus.CANCELLED) {
            throw new ConflictException("Registration is already cancelled", EventErrorCodes.ALREADY_CANCELLED);
        }
        if (!actor.is(registration.getUserId()) && !actor.isEventOffice()) {
            throw new ForbiddenException("Only the registrant or Event Office may cancel this registration");
        }
        if (!actor.isEventOffice()) {
            requireCancellable(registration.getEventId());
        }

        registration.setStatus(RegistrationStatus.CANCELLED);
        eventRepository.decrementRegisteredCount(registration.getEventId());

        // free registrations hold COMPLETED with nothing to give back
        boolean refund = registration.getPaymentStatus() == PaymentStatus.COMPLETED
                && registration.getPaymentAmount() > 0
                && !registration.isRefundRequested();
        if (refund) {
            registration.setPaymentStatus(PaymentStatus.REFUNDED);
            registration.setRefundRequested(true);
        }

        registration = registrationRepository.save(registration);

        if (refund) {
            eventPublisher.publishEvent(RefundRequestedEvent.of(registration, "Registration cancelled", clock.instant()));
            log.info("Refund requested for registration {}", registrationId);
        }
        log.info("Registration {} cancelled by {}", registrationId, actor.userId());
        return RegistrationResponse.from(registration);
    }

    @Transactional(readOnly = true)
    public RegistrationResponse getRegistration(UUID registrationId, Actor actor) {
        Registration registration = registrationRepository.findById(registrationId)
                .orElseThrow(() -> new ResourceNotFoundException("Registration", registrationId));
        if (!actor.is(registration.getUserId()) && !actor.isEventOffice()) {
            throw new ForbiddenException("Registration belongs to another user");
        }
        return RegistrationResponse.from(registration);
    }

    @Transactional(readOnly = true)
    public List<RegistrationResponse> getRegistrationsByUser(UUID userId, Actor actor) {
        if (!actor.is(userId) && !actor.isEventOffice()) {
            throw new ForbiddenException("Registrations belong to another user");
        }
        return registrationRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(RegistrationResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<RegistrationResponse> getRegistrationsByEvent(UUID eventId, Actor actor) {
        Event event = eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
        if (!actor.is(event.getCreatedBy()) && !actor.isEventOffice()) {
            throw new ForbiddenException("Only the event's creator or Event Office may list its registrations");
        }
        return registrationRepository.findByEventIdOrderByCreatedAtAsc(eventId).stream()
                .map(RegistrationResponse::from)
                .collect(Collectors.toList());
    }

    private void requireCancellable(UUID eventId) {
        Event event = eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
        Instant now = clock.instant();
        if (!now.isBefore(event.getStartDate())) {
            throw new ConflictException("Cannot cancel a registration once the event has started",
                    EventErrorCodes.EVENT_STARTED);
        }
        if (now.plus(Duration.ofDays(cancellationLeadDays)).isAfter(event.getStartDate())) {
            throw new ConflictException(
                    String.format("Cancellation must be done at least %d days before the event", cancellationLeadDays),
                    EventErrorCodes.CANCELLATION_WINDOW_CLOSED);
        }
    }

    private CapacityStrategy getCapacityStrategy() {
        String key = strategyType == null ? DEFAULT_STRATEGY : strategyType.toLowerCase();
        CapacityStrategy strategy = capacityStrategies.get(key);
        if (strategy == null) {
            log.warn("Unknown capacity strategy: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, capacityStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = capacityStrategies.get(DEFAULT_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " capacity strategy not found. Available strategies: "
                                + capacityStrategies.keySet());
            }
        }
        return strategy;
    }
}
