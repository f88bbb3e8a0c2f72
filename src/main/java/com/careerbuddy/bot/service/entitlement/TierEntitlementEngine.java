package com.careerbuddy.bot.service.entitlement;

import com.careerbuddy.bot.config.EntitlementProperties;
import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.Tier;
import com.careerbuddy.bot.model.User;
import com.careerbuddy.bot.repository.UserRepository;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tier limit table lookups and counter bookkeeping for ordinary users. Admin handling lives in
 * {@link AdminPolicyOverlay}.
 */
@Service
public class TierEntitlementEngine implements EntitlementEngine {

    private static final Logger log = LoggerFactory.getLogger(TierEntitlementEngine.class);

    private final EntitlementProperties properties;
    private final UserRepository userRepository;
    private final Clock clock;

    @Autowired
    public TierEntitlementEngine(EntitlementProperties properties, UserRepository userRepository, Clock clock) {
        this.properties = properties;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Override
    public boolean checkAndResetQuota(@NotNull User user) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime resetAt = user.getQuotaResetAt();
        if (resetAt != null && now.isBefore(resetAt)) {
            return false;
        }

        user.resetCounters();
        user.setQuotaResetAt(now.plusDays(properties.getCycleDays()));
        userRepository.save(user);

        if (resetAt != null) {
            log.info("Quota cycle reset for user {}, next reset at {}", user.getTelegramId(), user.getQuotaResetAt());
        }
        return true;
    }

    @Override
    public boolean checkPremiumExpiry(@NotNull User user) {
        if (user.getTier() != Tier.PRO) {
            return false;
        }
        LocalDateTime expiresAt = user.getPremiumExpiresAt();
        if (expiresAt == null || LocalDateTime.now(clock).isBefore(expiresAt)) {
            return false;
        }

        user.setTier(Tier.FREE);
        userRepository.save(user);
        log.info("Premium expired for user {}, downgraded to {}", user.getTelegramId(), Tier.FREE);
        return true;
    }

    @Override
    public GenerationDecision canGenerate(@NotNull User user, @NotNull DocumentType type) {
        int limit = properties.limitFor(user.getTier(), type);
        if (limit <= 0) {
            return GenerationDecision.notAllowed(type);
        }
        if (user.getUsed(type) >= limit) {
            return GenerationDecision.quotaExceeded(type, limit);
        }
        return GenerationDecision.allow(type, limit);
    }

    @Override
    public boolean canUsePdfExport(@NotNull User user) {
        return properties.isPdfAllowed(user.getTier());
    }

    @Override
    public void recordGeneration(@NotNull User user, @NotNull DocumentType type) {
        user.increment(type);
        userRepository.save(user);
        log.info("Recorded {} generation for user {}: {} used this cycle",
                type.getCode(), user.getTelegramId(), user.getUsed(type));
    }

    @Override
    public void upgrade(@NotNull User user) {
        LocalDateTime expiresAt = LocalDateTime.now(clock).plusDays(properties.getCycleDays());

        user.setTier(Tier.PRO);
        user.resetCounters();
        user.setPremiumExpiresAt(expiresAt);
        user.setQuotaResetAt(expiresAt);
        userRepository.save(user);

        log.info("User {} upgraded to {} until {}", user.getTelegramId(), Tier.PRO, expiresAt);
    }

    @Override
    public EntitlementStatus getStatus(@NotNull User user) {
        Map<DocumentType, QuotaUsage> perType = new EnumMap<>(DocumentType.class);
        for (DocumentType type : DocumentType.values()) {
            perType.put(type, QuotaUsage.of(user.getUsed(type), properties.limitFor(user.getTier(), type)));
        }

        return EntitlementStatus.builder()
                .tier(user.getTier())
                .admin(false)
                .perType(perType)
                .pdfAllowed(canUsePdfExport(user))
                .quotaResetAt(user.getQuotaResetAt())
                .premiumExpiresAt(user.getTier() == Tier.PRO ? user.getPremiumExpiresAt() : null)
                .build();
    }
}
