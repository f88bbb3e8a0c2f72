package com.careerbuddy.bot.service;

import com.careerbuddy.bot.model.Tier;
import com.careerbuddy.bot.model.User;
import com.careerbuddy.bot.repository.UserRepository;
import com.careerbuddy.bot.service.entitlement.EntitlementEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static com.careerbuddy.bot.constant.MessageTemplates.PREMIUM_ENDED;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubscriptionSchedulerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private final LocalDateTime now = LocalDateTime.now(clock);

    @Mock
    private UserRepository userRepository;
    @Mock
    private EntitlementEngine entitlementEngine;
    @Mock
    private NotificationSender notificationSender;

    private SubscriptionScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new SubscriptionScheduler(userRepository, entitlementEngine, notificationSender, clock);
    }

    private static User pro(long id, LocalDateTime expiresAt) {
        return User.builder().telegramId(id).tier(Tier.PRO).premiumExpiresAt(expiresAt).build();
    }

    @Test
    @DisplayName("Should downgrade expired users and tell them")
    void shouldDowngradeExpired() {
        User expired = pro(1L, now.minusHours(2));
        when(userRepository.findByTierAndPremiumExpiresAtBefore(Tier.PRO, now)).thenReturn(List.of(expired));
        when(entitlementEngine.checkPremiumExpiry(expired)).thenReturn(true);

        scheduler.downgradeExpired(now);

        verify(notificationSender).notify(1L, PREMIUM_ENDED);
    }

    @Test
    @DisplayName("Should keep sweeping after one user fails")
    void shouldContinueAfterFailure() {
        User broken = pro(1L, now.minusDays(1));
        User expired = pro(2L, now.minusDays(1));
        when(userRepository.findByTierAndPremiumExpiresAtBefore(Tier.PRO, now)).thenReturn(List.of(broken, expired));
        when(entitlementEngine.checkPremiumExpiry(broken)).thenThrow(new IllegalStateException("stale"));
        when(entitlementEngine.checkPremiumExpiry(expired)).thenReturn(true);

        scheduler.downgradeExpired(now);

        verify(notificationSender).notify(2L, PREMIUM_ENDED);
        verify(notificationSender, never()).notify(eq(1L), anyString());
    }

    @Test
    @DisplayName("Should reset elapsed quota cycles")
    void shouldResetCycles() {
        User due = User.builder().telegramId(3L).tier(Tier.FREE).quotaResetAt(now.minusDays(1)).build();
        when(userRepository.findByQuotaResetAtBefore(now)).thenReturn(List.of(due));

        scheduler.resetElapsedCycles(now);

        verify(entitlementEngine).checkAndResetQuota(due);
        verifyNoInteractions(notificationSender);
    }

    @Test
    @DisplayName("Should remind three days and one day before expiry only")
    void shouldSendReminders() {
        when(userRepository.findByTierAndPremiumExpiresAtBetween(Tier.PRO, now, now.plusDays(4))).thenReturn(List.of(
                pro(1L, now.plusDays(3)),
                pro(2L, now.plusDays(2)),
                pro(3L, now.plusDays(1))));

        scheduler.sendExpiryReminders(now);

        verify(notificationSender).notify(eq(1L), contains("3 days"));
        verify(notificationSender).notify(eq(3L), contains("1 day."));
        verify(notificationSender, never()).notify(eq(2L), anyString());
    }

    @Test
    @DisplayName("Should run every part of the sweep")
    void shouldRunSweep() {
        when(userRepository.findByTierAndPremiumExpiresAtBefore(any(), any())).thenReturn(List.of());
        when(userRepository.findByQuotaResetAtBefore(any())).thenReturn(List.of());
        when(userRepository.findByTierAndPremiumExpiresAtBetween(any(), any(), any())).thenReturn(List.of());

        scheduler.sweep();

        verify(userRepository).findByTierAndPremiumExpiresAtBefore(Tier.PRO, now);
        verify(userRepository).findByQuotaResetAtBefore(now);
        verify(notificationSender, never()).notify(anyLong(), anyString());
    }
}
