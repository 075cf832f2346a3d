package com.unievents.fulfillment.client;

import com.unievents.common.dto.BaseResponse;
import com.unievents.fulfillment.client.dto.CompletedEvent;
import com.unievents.fulfillment.client.dto.DueReminder;
import com.unievents.fulfillment.client.dto.EligibleRegistration;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;
import java.util.UUID;

/**
 * Feign client for the event service's internal fulfillment endpoints.
 * Queries are read-only and the mark call is idempotent, so every call is safe to repeat.
 */
@FeignClient(name = "event-service", url = "${fulfillment.event-service.url}", path = "/api/v1/fulfillment")
public interface EventCoreClient {

    @GetMapping("/reminders")
    BaseResponse<List<DueReminder>> getDueReminders(@RequestParam("windowMinutes") long windowMinutes);

    @GetMapping("/events/{eventId}/certificate-eligible")
    BaseResponse<List<EligibleRegistration>> getCertificateEligible(@PathVariable("eventId") UUID eventId);

    /**
     * Returns false in data when the certificate was already marked as sent.
     */
    @PostMapping("/registrations/{registrationId}/certificate-sent")
    BaseResponse<Boolean> markCertificateSent(@PathVariable("registrationId") UUID registrationId);

    /** since is an ISO-8601 instant. */
    @GetMapping("/completed-events")
    BaseResponse<List<CompletedEvent>> getCompletedEvents(@RequestParam("since") String since);
}
