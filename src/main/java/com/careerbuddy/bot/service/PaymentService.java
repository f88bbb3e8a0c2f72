package com.careerbuddy.bot.service;

import com.careerbuddy.bot.constant.BotConstants;
import com.careerbuddy.bot.dto.PaymentEvent;
import com.careerbuddy.bot.dto.PaymentLink;
import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.Job;
import com.careerbuddy.bot.model.JobStatus;
import com.careerbuddy.bot.model.Payment;
import com.careerbuddy.bot.model.PaymentPurpose;
import com.careerbuddy.bot.model.User;
import com.careerbuddy.bot.repository.JobRepository;
import com.careerbuddy.bot.repository.PaymentRepository;
import com.careerbuddy.bot.repository.UserRepository;
import com.careerbuddy.bot.service.entitlement.EntitlementEngine;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.careerbuddy.bot.constant.MessageTemplates.PAYMENT_DOCUMENT_CONFIRMED;
import static com.careerbuddy.bot.constant.MessageTemplates.PAYMENT_PREMIUM_CONFIRMED;

@Service
public class PaymentService {

    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

    private static final String HMAC_ALGORITHM = "HmacSHA512";

    private final RestTemplate restTemplate;
    private final PaymentRepository paymentRepository;
    private final UserRepository userRepository;
    private final JobRepository jobRepository;
    private final EntitlementEngine entitlementEngine;
    private final Clock clock;

    @Value("${payment.api.url}")
    private String apiUrl;

    @Value("${payment.secret-key:}")
    private String secretKey;

    @Value("${payment.callback-url:}")
    private String callbackUrl;

    @Value("${payment.premium-price:7500}")
    private long premiumPrice;

    @Value("${payment.document-price:7500}")
    private long documentPrice;

    @Value("${payment.currency:NGN}")
    private String currency;

    @Autowired
    public PaymentService(RestTemplate restTemplate,
                          PaymentRepository paymentRepository,
                          UserRepository userRepository,
                          JobRepository jobRepository,
                          EntitlementEngine entitlementEngine,
                          Clock clock) {
        this.restTemplate = restTemplate;
        this.paymentRepository = paymentRepository;
        this.userRepository = userRepository;
        this.jobRepository = jobRepository;
        this.entitlementEngine = entitlementEngine;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return secretKey != null && !secretKey.isBlank();
    }

    /**
     * Initializes a checkout with the provider and records it as pending.
     *
     * @param purpose {@link PaymentPurpose#PREMIUM_UPGRADE} or a document type code
     * @param jobId   job unlocked by a document payment, null for upgrades
     * @return empty when payments are not configured or the provider call failed
     */
    public Optional<PaymentLink> createPaymentLink(@NotNull User user, @NotNull String purpose, Long jobId) {
        if (!isEnabled()) {
            log.warn("Payment link requested by user {} but no payment secret is configured", user.getTelegramId());
            return Optional.empty();
        }

        boolean premium = PaymentPurpose.isPremiumUpgrade(purpose);
        long amount = premium ? premiumPrice : documentPrice;
        String description = describe(purpose);
        String reference = "cb-" + UUID.randomUUID();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(secretKey);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("userId", user.getTelegramId());
        metadata.put("purpose", purpose);
        if (jobId != null) {
            metadata.put("jobId", jobId);
        }

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("email", "user_" + user.getTelegramId() + "@careerbuddy.temp");
        requestBody.put("amount", amount * 100);
        requestBody.put("currency", currency);
        requestBody.put("reference", reference);
        requestBody.put("callback_url", callbackUrl);
        requestBody.put("metadata", metadata);

        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(requestBody, headers);

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(apiUrl, HttpMethod.POST, entity, JsonNode.class);
            JsonNode body = response.getBody();
            if (body == null || !body.path("status").asBoolean(false)) {
                log.error("Payment provider rejected checkout for user {}: {}", user.getTelegramId(),
                        body == null ? "empty response" : body.path("message").asText());
                return Optional.empty();
            }

            JsonNode data = body.path("data");
            String url = data.path("authorization_url").asText(null);
            if (url == null || url.isBlank()) {
                log.error("Payment provider returned no checkout url for user {}", user.getTelegramId());
                return Optional.empty();
            }
            String confirmedReference = data.path("reference").asText(reference);

            Payment payment = Payment.builder()
                    .reference(confirmedReference)
                    .user(user)
                    .jobId(jobId)
                    .purpose(purpose)
                    .amount(amount)
                    .status(BotConstants.PAYMENT_PENDING)
                    .paymentDate(LocalDateTime.now(clock))
                    .description(description)
                    .build();
            paymentRepository.save(payment);

            log.info("Payment {} created for user {} ({})", confirmedReference, user.getTelegramId(), purpose);
            return Optional.of(PaymentLink.builder()
                    .reference(confirmedReference)
                    .url(url)
                    .amount(amount)
                    .description(description)
                    .build());
        } catch (RestClientException e) {
            log.error("Payment provider call failed for user {}: {}", user.getTelegramId(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Applies a provider notification. Each reference is applied at most once; a redelivered
     * success event changes nothing.
     *
     * @return the chat notification for the paying user, if the event changed anything
     */
    @Transactional
    public Optional<PaymentOutcome> processPaymentEvent(@NotNull PaymentEvent event) {
        if (event.getReference() == null || event.getReference().isBlank()) {
            throw new IllegalArgumentException("Payment event without reference");
        }

        Optional<Payment> existing = paymentRepository.findByReference(event.getReference());
        if (existing.isPresent() && BotConstants.PAYMENT_SUCCESS.equals(existing.get().getStatus())) {
            log.warn("Payment {} already applied, ignoring redelivery", event.getReference());
            return Optional.empty();
        }

        if (!event.isSuccessful()) {
            existing.ifPresent(payment -> {
                payment.setStatus(BotConstants.PAYMENT_FAILED);
                paymentRepository.save(payment);
            });
            log.info("Payment {} reported as {}", event.getReference(), event.getStatus());
            return Optional.empty();
        }

        Optional<User> userOptional = existing.map(Payment::getUser)
                .or(() -> Optional.ofNullable(event.getUserId()).flatMap(userRepository::findByTelegramId));
        if (userOptional.isEmpty()) {
            log.warn("Payment {} does not belong to a known user", event.getReference());
            return Optional.empty();
        }
        User user = userOptional.get();

        String purpose = existing.map(Payment::getPurpose).orElse(event.getPurpose());
        if (purpose == null) {
            throw new IllegalArgumentException("Payment event " + event.getReference() + " has no purpose");
        }

        Payment payment = existing.orElseGet(() -> Payment.builder()
                .reference(event.getReference())
                .user(user)
                .jobId(event.getJobId())
                .purpose(purpose)
                .amount(event.getAmount() == null ? 0 : event.getAmount() / 100)
                .description(describe(purpose))
                .build());
        payment.setStatus(BotConstants.PAYMENT_SUCCESS);
        payment.setPaymentDate(LocalDateTime.now(clock));
        paymentRepository.save(payment);

        if (PaymentPurpose.isPremiumUpgrade(purpose)) {
            entitlementEngine.upgrade(user);
            log.info("Payment {} applied: user {} upgraded", payment.getReference(), user.getTelegramId());
            return Optional.of(new PaymentOutcome(user.getTelegramId(), PAYMENT_PREMIUM_CONFIRMED));
        }

        Optional<DocumentType> documentType = PaymentPurpose.documentType(purpose);
        if (documentType.isEmpty()) {
            throw new IllegalArgumentException("Unknown payment purpose: " + purpose);
        }

        Long jobId = payment.getJobId() != null ? payment.getJobId() : event.getJobId();
        Optional<Job> job = Optional.ofNullable(jobId)
                .flatMap(jobRepository::findById)
                .or(() -> jobRepository.findFirstByUserTelegramIdAndStatusOrderByCreatedAtDesc(
                        user.getTelegramId(), JobStatus.AWAITING_PAYMENT))
                .filter(candidate -> candidate.getStatus() == JobStatus.AWAITING_PAYMENT)
                .filter(candidate -> candidate.getDocumentType() == documentType.get());

        if (job.isEmpty()) {
            log.warn("Payment {} for {} has no job awaiting payment", payment.getReference(), purpose);
            return Optional.empty();
        }

        Job paidJob = job.get();
        paidJob.setStatus(JobStatus.PAID);
        paidJob.setUpdatedAt(LocalDateTime.now(clock));
        jobRepository.save(paidJob);

        log.info("Payment {} applied: job {} marked {}", payment.getReference(), paidJob.getId(), JobStatus.PAID);
        return Optional.of(new PaymentOutcome(user.getTelegramId(),
                String.format(PAYMENT_DOCUMENT_CONFIRMED, documentType.get().getDisplayName())));
    }

    /**
     * HMAC-SHA512 of the raw body with the secret key, hex encoded. Always true when no secret is
     * configured.
     */
    public boolean verifySignature(@NotNull String rawBody, String signature) {
        if (!isEnabled()) {
            return true;
        }
        if (signature == null || signature.isBlank()) {
            return false;
        }
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] expected = mac.doFinal(rawBody.getBytes(StandardCharsets.UTF_8));
            byte[] actual = HexFormat.of().parseHex(signature.trim().toLowerCase());
            return MessageDigest.isEqual(expected, actual);
        } catch (IllegalArgumentException e) {
            return false;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA512 is not available", e);
        }
    }

    public String getCurrency() {
        return currency;
    }

    public long getPremiumPrice() {
        return premiumPrice;
    }

    public long getDocumentPrice() {
        return documentPrice;
    }

    private String describe(String purpose) {
        if (PaymentPurpose.isPremiumUpgrade(purpose)) {
            return "Career Buddy Premium (30 days)";
        }
        return PaymentPurpose.documentType(purpose)
                .map(type -> "Career Buddy " + type.getDisplayName())
                .orElse("Career Buddy payment");
    }

    @Getter
    @AllArgsConstructor
    public static class PaymentOutcome {
        private final Long telegramId;
        private final String message;
    }
}
