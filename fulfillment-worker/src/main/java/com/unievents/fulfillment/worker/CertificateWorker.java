package com.unievents.fulfillment.worker;

import com.unievents.common.dto.BaseResponse;
import com.unievents.fulfillment.client.EventCoreClient;
import com.unievents.fulfillment.client.dto.CompletedEvent;
import com.unievents.fulfillment.client.dto.EligibleRegistration;
import com.unievents.fulfillment.delivery.DeliveryLedger;
import com.unievents.fulfillment.delivery.NotificationSender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Issues certificates of attendance for events completed within the lookback period.
 * A certificate is sent once (ledger claim) and then marked on the core, which is idempotent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CertificateWorker {

    private final EventCoreClient eventCoreClient;
    private final DeliveryLedger deliveryLedger;
    private final NotificationSender notificationSender;
    private final Clock clock;

    @Value("${fulfillment.certificates.enabled:true}")
    private boolean enabled = true;

    @Value("${fulfillment.certificates.lookback-days:30}")
    private long lookbackDays = 30;

    @Scheduled(fixedDelayString = "${fulfillment.certificates.interval-ms:1800000}")
    public void issueCertificates() {
        if (!enabled) return;
        Instant since = clock.instant().minus(Duration.ofDays(lookbackDays));
        List<CompletedEvent> events;
        try {
            events = dataOf(eventCoreClient.getCompletedEvents(since.toString()));
        } catch (Exception e) {
            log.error("Could not list completed events; retrying next tick", e);
            return;
        }
        for (CompletedEvent event : events) {
            try {
                issueFor(event);
            } catch (Exception e) {
                log.error("Certificate run for event {} failed; retrying next tick", event.id(), e);
            }
        }
    }

    private void issueFor(CompletedEvent event) {
        List<EligibleRegistration> eligible = dataOf(eventCoreClient.getCertificateEligible(event.id()));
        for (EligibleRegistration registration : eligible) {
            String key = DeliveryLedger.certificateKey(registration.id());
            if (deliveryLedger.claim(key)) {
                try {
                    notificationSender.sendCertificate(registration, event);
                } catch (Exception e) {
                    log.error("Certificate for registration {} failed", registration.id(), e);
                    deliveryLedger.release(key);
                    continue;
                }
            } else {
                // already sent on an earlier tick whose mark call did not go through
                log.debug("Certificate for registration {} already delivered, re-marking", registration.id());
            }
            markSent(registration);
        }
    }

    private void markSent(EligibleRegistration registration) {
        BaseResponse<Boolean> marked = eventCoreClient.markCertificateSent(registration.id());
        if (!Boolean.TRUE.equals(marked.getData())) {
            log.debug("Certificate for registration {} was already marked", registration.id());
        }
    }

    private static <T> List<T> dataOf(BaseResponse<List<T>> response) {
        return response == null || response.getData() == null ? List.of() : response.getData();
    }
}
