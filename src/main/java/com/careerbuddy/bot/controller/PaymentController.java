package com.careerbuddy.bot.controller;

import com.careerbuddy.bot.constant.BotConstants;
import com.careerbuddy.bot.dto.PaymentEvent;
import com.careerbuddy.bot.service.NotificationSender;
import com.careerbuddy.bot.service.PaymentService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Payment provider notifications. Accepts the normalized
 * {@code {reference, status, metadata: {userId, purpose, jobId}}} body as well as the provider's
 * own {@code {event, data: {...}}} envelope.
 */
@RestController
@RequestMapping("/payment")
@Slf4j
public class PaymentController {

    static final String SIGNATURE_HEADER = "X-Payment-Signature";

    private final PaymentService paymentService;
    private final NotificationSender notificationSender;
    private final ObjectMapper objectMapper;

    @Autowired
    public PaymentController(PaymentService paymentService,
                             NotificationSender notificationSender,
                             ObjectMapper objectMapper) {
        this.paymentService = paymentService;
        this.notificationSender = notificationSender;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/webhook")
    public ResponseEntity<String> handlePaymentWebhook(@RequestBody String rawBody,
                                                       @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        if (!paymentService.verifySignature(rawBody, signature)) {
            throw new SecurityException("Payment webhook signature mismatch");
        }

        PaymentEvent event = parse(rawBody);
        log.info("Payment event {} with status {}", event.getReference(), event.getStatus());

        paymentService.processPaymentEvent(event)
                .ifPresent(outcome -> notificationSender.notify(outcome.getTelegramId(), outcome.getMessage()));

        return ResponseEntity.ok("OK");
    }

    @NotNull
    PaymentEvent parse(@NotNull String rawBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payment webhook body is not JSON", e);
        }

        JsonNode payload = root;
        String status = root.path("status").asText(null);
        if (root.has("event") && root.has("data")) {
            payload = root.path("data");
            status = BotConstants.EVENT_CHARGE_SUCCESS.equals(root.path("event").asText())
                    ? BotConstants.PAYMENT_SUCCESS
                    : payload.path("status").asText(null);
        }

        JsonNode metadata = payload.path("metadata");
        return PaymentEvent.builder()
                .reference(payload.path("reference").asText(null))
                .status(status)
                .userId(longValue(metadata, "userId", "user_id"))
                .purpose(metadata.path("purpose").asText(null))
                .jobId(longValue(metadata, "jobId", "job_id"))
                .amount(payload.hasNonNull("amount") ? payload.path("amount").asLong() : null)
                .build();
    }

    private static Long longValue(JsonNode node, String name, String alternative) {
        JsonNode value = node.hasNonNull(name) ? node.get(name) : node.get(alternative);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + " in payment metadata", e);
        }
    }
}
