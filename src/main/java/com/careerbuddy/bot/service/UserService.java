package com.careerbuddy.bot.service;

import com.careerbuddy.bot.dto.InboundMessage;
import com.careerbuddy.bot.model.Tier;
import com.careerbuddy.bot.model.User;
import com.careerbuddy.bot.repository.GenerationLogRepository;
import com.careerbuddy.bot.repository.UserRepository;
import com.careerbuddy.bot.service.entitlement.EntitlementEngine;
import lombok.Builder;
import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final GenerationLogRepository generationLogRepository;
    private final EntitlementEngine entitlementEngine;
    private final Clock clock;

    @Autowired
    public UserService(UserRepository userRepository,
                       GenerationLogRepository generationLogRepository,
                       EntitlementEngine entitlementEngine,
                       Clock clock) {
        this.userRepository = userRepository;
        this.generationLogRepository = generationLogRepository;
        this.entitlementEngine = entitlementEngine;
        this.clock = clock;
    }

    @NotNull
    public User registerUserIfNeeded(@NotNull InboundMessage message) {
        Optional<User> existing = userRepository.findByTelegramId(message.getUserId());
        if (existing.isPresent()) {
            return existing.get();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        User user = User.builder()
                .telegramId(message.getUserId())
                .firstName(message.getFirstName())
                .username(message.getUsername())
                .tier(Tier.FREE)
                .registeredAt(now)
                .lastActivity(now)
                .build();
        user.resetCounters();

        User saved = userRepository.save(user);
        log.info("Registered user {}", saved.getTelegramId());
        return saved;
    }

    public void touch(@NotNull User user) {
        user.setLastActivity(LocalDateTime.now(clock));
        userRepository.save(user);
    }

    public Optional<User> findByTelegramId(Long telegramId) {
        return userRepository.findByTelegramId(telegramId);
    }

    /** Manual upgrade by an operator. */
    public void grantPremium(@NotNull User user) {
        entitlementEngine.upgrade(user);
        log.info("User {} upgraded to premium by an administrator", user.getTelegramId());
    }

    public boolean hasActivePremium(@NotNull User user) {
        return user.isPro() && user.getPremiumExpiresAt() != null
                && user.getPremiumExpiresAt().isAfter(LocalDateTime.now(clock));
    }

    @NotNull
    public UsageStats getStats() {
        return UsageStats.builder()
                .users(userRepository.count())
                .premiumUsers(userRepository.countByTier(Tier.PRO))
                .freeUsers(userRepository.countByTier(Tier.FREE))
                .documents(generationLogRepository.count())
                .paidDocuments(generationLogRepository.countPaidGenerations())
                .build();
    }

    @Getter
    @Builder
    public static class UsageStats {
        private final long users;
        private final long premiumUsers;
        private final long freeUsers;
        private final long documents;
        private final long paidDocuments;
    }
}
