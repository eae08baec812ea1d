package com.campuseats.orderservice.controller;

import com.campuseats.orderservice.dto.PaymentVerificationRequest;
import com.campuseats.orderservice.dto.PaymentVerificationResponse;
import com.campuseats.orderservice.service.OrderCompletionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final OrderCompletionService orderCompletionService;

    @PostMapping("/verify")
    public ResponseEntity<PaymentVerificationResponse> verifyPayment(
            @Valid @RequestBody PaymentVerificationRequest request,
            @RequestHeader(IdentityHeaders.USER_ID) UUID userId) {
        PaymentVerificationResponse response = orderCompletionService.verifyPayment(request, userId);
        if (!response.isVerified()) {
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }
}
