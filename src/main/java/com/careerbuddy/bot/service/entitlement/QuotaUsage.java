package com.careerbuddy.bot.service.entitlement;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class QuotaUsage {

    /** Reported as limit and remaining for identities without any limit. */
    public static final int UNLIMITED = -1;

    private final int used;
    private final int limit;
    private final int remaining;

    public static QuotaUsage of(int used, int limit) {
        return new QuotaUsage(used, limit, Math.max(0, limit - used));
    }

    public static QuotaUsage unlimited(int used) {
        return new QuotaUsage(used, UNLIMITED, UNLIMITED);
    }

    public boolean isUnlimited() {
        return limit == UNLIMITED;
    }
}
