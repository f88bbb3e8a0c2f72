package com.careerbuddy.bot.service;

import com.careerbuddy.bot.model.Tier;
import com.careerbuddy.bot.model.User;
import com.careerbuddy.bot.repository.UserRepository;
import com.careerbuddy.bot.service.entitlement.EntitlementEngine;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static com.careerbuddy.bot.constant.MessageTemplates.PREMIUM_ENDED;
import static com.careerbuddy.bot.constant.MessageTemplates.PREMIUM_REMINDER;

/**
 * Daily entitlement sweep for users who stopped interacting. The per-turn lazy checks stay
 * authoritative; this only applies the same transitions earlier and sends expiry reminders.
 */
@Component
public class SubscriptionScheduler {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionScheduler.class);

    private final UserRepository userRepository;
    private final EntitlementEngine entitlementEngine;
    private final NotificationSender notificationSender;
    private final Clock clock;

    @Autowired
    public SubscriptionScheduler(UserRepository userRepository,
                                 EntitlementEngine entitlementEngine,
                                 NotificationSender notificationSender,
                                 Clock clock) {
        this.userRepository = userRepository;
        this.entitlementEngine = entitlementEngine;
        this.notificationSender = notificationSender;
        this.clock = clock;
    }

    @Scheduled(cron = "${entitlements.sweep-cron:0 0 12 * * ?}")
    public void sweep() {
        LocalDateTime now = LocalDateTime.now(clock);
        log.info("Running entitlement sweep");

        downgradeExpired(now);
        resetElapsedCycles(now);
        sendExpiryReminders(now);
    }

    void downgradeExpired(@NotNull LocalDateTime now) {
        List<User> expired = userRepository.findByTierAndPremiumExpiresAtBefore(Tier.PRO, now);
        for (User user : expired) {
            try {
                if (entitlementEngine.checkPremiumExpiry(user)) {
                    notificationSender.notify(user.getTelegramId(), PREMIUM_ENDED);
                }
            } catch (RuntimeException e) {
                log.error("Failed to downgrade user {}: {}", user.getTelegramId(), e.getMessage(), e);
            }
        }
    }

    void resetElapsedCycles(@NotNull LocalDateTime now) {
        int reset = 0;
        for (User user : userRepository.findByQuotaResetAtBefore(now)) {
            try {
                if (entitlementEngine.checkAndResetQuota(user)) {
                    reset++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to reset quota of user {}: {}", user.getTelegramId(), e.getMessage(), e);
            }
        }
        if (reset > 0) {
            log.info("Reset quota cycles of {} users", reset);
        }
    }

    void sendExpiryReminders(@NotNull LocalDateTime now) {
        List<User> expiring = userRepository.findByTierAndPremiumExpiresAtBetween(Tier.PRO, now, now.plusDays(4));
        for (User user : expiring) {
            long daysLeft = ChronoUnit.DAYS.between(now.toLocalDate(), user.getPremiumExpiresAt().toLocalDate());
            if (daysLeft == 3 || daysLeft == 1) {
                notificationSender.notify(user.getTelegramId(),
                        String.format(PREMIUM_REMINDER, daysLeft, daysLeft == 1 ? "" : "s"));
            }
        }
    }
}
