package com.unievents.event.api.controller;

import com.unievents.common.dto.BaseResponse;
import com.unievents.event.api.dto.DueReminderResponse;
import com.unievents.event.api.dto.EventResponse;
import com.unievents.event.api.dto.RegistrationResponse;
import com.unievents.event.domain.service.FulfillmentService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Internal endpoints polled by the fulfillment worker. Not exposed through the public gateway.
 */
@RestController
@RequestMapping("/api/v1/fulfillment")
@RequiredArgsConstructor
public class FulfillmentController {

    private final FulfillmentService fulfillmentService;

    @GetMapping("/reminders")
    public ResponseEntity<BaseResponse<List<DueReminderResponse>>> getDueReminders(
            @RequestParam(defaultValue = "60") long windowMinutes) {
        return ResponseEntity.ok(BaseResponse.success(
                fulfillmentService.dueReminders(Duration.ofMinutes(windowMinutes))));
    }

    @GetMapping("/events/{eventId}/certificate-eligible")
    public ResponseEntity<BaseResponse<List<RegistrationResponse>>> getCertificateEligible(
            @PathVariable UUID eventId) {
        return ResponseEntity.ok(BaseResponse.success(fulfillmentService.certificateEligible(eventId)));
    }

    @PostMapping("/registrations/{registrationId}/certificate-sent")
    public ResponseEntity<BaseResponse<Boolean>> markCertificateSent(@PathVariable UUID registrationId) {
        return ResponseEntity.ok(BaseResponse.success(fulfillmentService.markCertificateSent(registrationId)));
    }

    @PostMapping("/registrations/{registrationId}/attended")
    public ResponseEntity<BaseResponse<RegistrationResponse>> markAttended(@PathVariable UUID registrationId) {
        return ResponseEntity.ok(BaseResponse.success(fulfillmentService.markAttended(registrationId)));
    }

    @GetMapping("/completed-events")
    public ResponseEntity<BaseResponse<List<EventResponse>>> getCompletedEvents(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {
        return ResponseEntity.ok(BaseResponse.success(fulfillmentService.completedEventsSince(since)));
    }
}
