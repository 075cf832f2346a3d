package com.unievents.event.api.controller;

import com.unievents.common.dto.BaseResponse;
import com.unievents.event.api.dto.RegistrationResponse;
import com.unievents.event.domain.service.PaymentCallbackService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Callbacks from the payment provider. Delivery is at-least-once.
 */
@RestController
@RequestMapping("/api/v1/payments/webhook")
@RequiredArgsConstructor
public class PaymentWebhookController {

    private final PaymentCallbackService paymentCallbackService;

    @PostMapping("/{registrationId}/completed")
    public ResponseEntity<BaseResponse<RegistrationResponse>> onPaymentCompleted(@PathVariable UUID registrationId) {
        return ResponseEntity.ok(BaseResponse.success(paymentCallbackService.onPaymentCompleted(registrationId)));
    }

    @PostMapping("/{registrationId}/failed")
    public ResponseEntity<BaseResponse<RegistrationResponse>> onPaymentFailed(@PathVariable UUID registrationId) {
        return ResponseEntity.ok(BaseResponse.success(paymentCallbackService.onPaymentFailed(registrationId)));
    }
}
