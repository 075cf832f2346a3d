package com.unievents.event.domain.service;

import com.unievents.common.exception.ConflictException;
import com.unievents.common.exception.ResourceNotFoundException;
import com.unievents.event.api.dto.RegistrationResponse;
import com.unievents.event.domain.exception.EventErrorCodes;
import com.unievents.event.domain.model.PaymentStatus;
import com.unievents.event.domain.model.Registration;
import com.unievents.event.domain.model.RegistrationStatus;
import com.unievents.event.domain.repository.RegistrationRepository;
import com.unievents.event.events.RefundRequestedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Applies payment-provider callbacks to a registration's payment state.
 * Callbacks may be delivered more than once; a repeated outcome is a no-op.
 * registeredCount is never touched here.
 *
 * Payment state:
 * PENDING -> COMPLETED | FAILED
 * FAILED -> COMPLETED (retried payment)
 * COMPLETED -> REFUNDED (cancel only)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentCallbackService {

    private final RegistrationRepository registrationRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public RegistrationResponse onPaymentCompleted(UUID registrationId) {
        Registration registration = lockRegistration(registrationId);
        PaymentStatus current = registration.getPaymentStatus();

        if (current == PaymentStatus.COMPLETED) {
            log.debug("Duplicate payment completion for registration {}", registrationId);
            return RegistrationResponse.from(registration);
        }
        if (current == PaymentStatus.REFUNDED) {
            throw invalidTransition(registrationId, current, PaymentStatus.COMPLETED);
        }

        if (registration.getStatus() == RegistrationStatus.CANCELLED) {
            // money arrived after the seat was given up: hand it straight back
            registration.setPaymentStatus(PaymentStatus.REFUNDED);
            boolean firstRefund = !registration.isRefundRequested();
            registration.setRefundRequested(true);
            registration = registrationRepository.save(registration);
            if (firstRefund) {
                eventPublisher.publishEvent(RefundRequestedEvent.of(
                        registration, "Payment completed after cancellation", clock.instant()));
            }
            log.info("Late payment on cancelled registration {}, refund requested", registrationId);
            return RegistrationResponse.from(registration);
        }

        registration.setPaymentStatus(PaymentStatus.COMPLETED);
        if (registration.getStatus() == RegistrationStatus.PENDING) {
            registration.setStatus(RegistrationStatus.CONFIRMED);
        }
        registration = registrationRepository.save(registration);
        log.info("Payment completed for registration {}", registrationId);
        return RegistrationResponse.from(registration);
    }

    @Transactional
    public RegistrationResponse onPaymentFailed(UUID registrationId) {
        Registration registration = lockRegistration(registrationId);
        PaymentStatus current = registration.getPaymentStatus();

        if (current == PaymentStatus.FAILED) {
            log.debug("Duplicate payment failure for registration {}", registrationId);
            return RegistrationResponse.from(registration);
        }
        if (current != PaymentStatus.PENDING) {
            throw invalidTransition(registrationId, current, PaymentStatus.FAILED);
        }

        registration.setPaymentStatus(PaymentStatus.FAILED);
        registration = registrationRepository.save(registration);
        log.info("Payment failed for registration {}", registrationId);
        return RegistrationResponse.from(registration);
    }

    private Registration lockRegistration(UUID registrationId) {
        return registrationRepository.findByIdForUpdate(registrationId)
                .orElseThrow(() -> new ResourceNotFoundException("Registration", registrationId));
    }

    private ConflictException invalidTransition(UUID registrationId, PaymentStatus from, PaymentStatus to) {
        return new ConflictException(
                String.format("Payment of registration %s cannot move from %s to %s", registrationId, from, to),
                EventErrorCodes.INVALID_PAYMENT_TRANSITION);
    }
}
