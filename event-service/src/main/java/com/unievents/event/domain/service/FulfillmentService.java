package com.unievents.event.domain.service;

import com.unievents.common.exception.BusinessException;
import com.unievents.common.exception.ConflictException;
import com.unievents.common.exception.ResourceNotFoundException;
import com.unievents.event.api.dto.DueReminderResponse;
import com.unievents.event.api.dto.EventResponse;
import com.unievents.event.api.dto.RegistrationResponse;
import com.unievents.event.domain.exception.EventErrorCodes;
import com.unievents.event.domain.model.Event;
import com.unievents.event.domain.model.EventStatus;
import com.unievents.event.domain.model.Registration;
import com.unievents.event.domain.model.RegistrationStatus;
import com.unievents.event.domain.repository.EventRepository;
import com.unievents.event.domain.repository.RegistrationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Query surface polled by the reminder and certificate workers, plus the two write hooks they
 * (and the check-in scanner) need. Every call is safe to repeat.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FulfillmentService {

    private final EventRepository eventRepository;
    private final RegistrationRepository registrationRepository;
    private final Clock clock;

    /**
     * Non-cancelled registrations of PUBLISHED, non-archived events starting within [now, now + window].
     */
    @Transactional(readOnly = true)
    public List<DueReminderResponse> dueReminders(Duration window) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new BusinessException("Reminder window must be positive", EventErrorCodes.VALIDATION_ERROR);
        }
        Instant now = clock.instant();
        return registrationRepository.findDueReminders(
                        EventStatus.PUBLISHED, now, now.plus(window), RegistrationStatus.CANCELLED)
                .stream()
                .map(DueReminderResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<RegistrationResponse> certificateEligible(UUID eventId) {
        Event event = eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
        if (event.getStatus() != EventStatus.COMPLETED) {
            throw new ConflictException(
                    String.format("Event %s is %s, certificates are issued after completion", eventId, event.getStatus()),
                    EventErrorCodes.EVENT_NOT_COMPLETED);
        }
        return registrationRepository.findCertificateCandidates(eventId, RegistrationStatus.CANCELLED).stream()
                .map(RegistrationResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * Sets certificateIssued once. Returns true if this call set it, false if it was already set.
     */
    @Transactional
    public boolean markCertificateSent(UUID registrationId) {
        int updated = registrationRepository.markCertificateIssued(registrationId, clock.instant());
        if (updated == 0) {
            if (!registrationRepository.existsById(registrationId)) {
                throw new ResourceNotFoundException("Registration", registrationId);
            }
            log.debug("Certificate for registration {} already marked as sent", registrationId);
            return false;
        }
        log.info("Certificate marked as sent for registration {}", registrationId);
        return true;
    }

    /**
     * QR check-in. Only CONFIRMED registrations can attend; a second scan is a no-op.
     */
    @Transactional
    public RegistrationResponse markAttended(UUID registrationId) {
        Registration registration = registrationRepository.findByIdForUpdate(registrationId)
                .orElseThrow(() -> new ResourceNotFoundException("Registration", registrationId));
        if (registration.getStatus() != RegistrationStatus.CONFIRMED) {
            throw new ConflictException(
                    String.format("Registration %s is %s, only confirmed registrations can check in",
                            registrationId, registration.getStatus()),
                    EventErrorCodes.REGISTRATION_NOT_CONFIRMED);
        }
        if (!registration.isAttended()) {
            registration.setAttended(true);
            registration.setAttendedAt(clock.instant());
            registration = registrationRepository.save(registration);
            log.info("Registration {} checked in", registrationId);
        }
        return RegistrationResponse.from(registration);
    }

    /**
     * COMPLETED events that ended at or after {@code since}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<EventResponse> completedEventsSince(Instant since) {
        return eventRepository.findByStatusAndEndDateGreaterThanEqualOrderByEndDateAsc(EventStatus.COMPLETED, since)
                .stream()
                .map(EventResponse::from)
                .collect(Collectors.toList());
    }
}
