package com.careerbuddy.bot.service.entitlement;

import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.User;

/**
 * Per-user quota counters and the free/pro tier state machine.
 * <p>
 * Time based transitions are lazy: callers run {@link #checkAndResetQuota(User)} and
 * {@link #checkPremiumExpiry(User)} at the start of every interaction, before any quota read.
 */
public interface EntitlementEngine {

    /**
     * Zeroes all counters and starts a new cycle once the reset instant has passed.
     *
     * @return true if the counters were reset
     */
    boolean checkAndResetQuota(User user);

    /**
     * Moves an expired pro user back to free. Counters are left as they are.
     *
     * @return true if the user was downgraded
     */
    boolean checkPremiumExpiry(User user);

    GenerationDecision canGenerate(User user, DocumentType type);

    boolean canUsePdfExport(User user);

    void recordGeneration(User user, DocumentType type);

    void upgrade(User user);

    EntitlementStatus getStatus(User user);
}
