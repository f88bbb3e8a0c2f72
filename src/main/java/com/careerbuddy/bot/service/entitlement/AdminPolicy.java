package com.careerbuddy.bot.service.entitlement;

import com.careerbuddy.bot.model.User;
import org.jetbrains.annotations.Contract;

import java.util.Collection;
import java.util.Set;

/**
 * Membership test against the configured operator identities. Holds no other state.
 */
public class AdminPolicy {

    private final Set<Long> adminIds;

    public AdminPolicy(Collection<Long> adminIds) {
        this.adminIds = adminIds == null ? Set.of() : Set.copyOf(adminIds);
    }

    @Contract("null -> false")
    public boolean isAdmin(User user) {
        return user != null && isAdmin(user.getTelegramId());
    }

    public boolean isAdmin(Long telegramId) {
        return telegramId != null && adminIds.contains(telegramId);
    }

    public Set<Long> getAdminIds() {
        return adminIds;
    }
}
