package com.careerbuddy.bot.service.entitlement;

import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.User;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Wraps every entitlement entry point. Admin identities are never limited and never have their
 * counters touched; everyone else goes straight to the delegate.
 */
@Primary
@Service
public class AdminPolicyOverlay implements EntitlementEngine {

    private final EntitlementEngine delegate;
    private final AdminPolicy adminPolicy;

    @Autowired
    public AdminPolicyOverlay(TierEntitlementEngine delegate, AdminPolicy adminPolicy) {
        this((EntitlementEngine) delegate, adminPolicy);
    }

    AdminPolicyOverlay(EntitlementEngine delegate, AdminPolicy adminPolicy) {
        this.delegate = delegate;
        this.adminPolicy = adminPolicy;
    }

    @Override
    public boolean checkAndResetQuota(User user) {
        return !adminPolicy.isAdmin(user) && delegate.checkAndResetQuota(user);
    }

    @Override
    public boolean checkPremiumExpiry(User user) {
        return !adminPolicy.isAdmin(user) && delegate.checkPremiumExpiry(user);
    }

    @Override
    public GenerationDecision canGenerate(User user, DocumentType type) {
        if (adminPolicy.isAdmin(user)) {
            return GenerationDecision.allow(type, QuotaUsage.UNLIMITED);
        }
        return delegate.canGenerate(user, type);
    }

    @Override
    public boolean canUsePdfExport(User user) {
        return adminPolicy.isAdmin(user) || delegate.canUsePdfExport(user);
    }

    @Override
    public void recordGeneration(User user, DocumentType type) {
        if (!adminPolicy.isAdmin(user)) {
            delegate.recordGeneration(user, type);
        }
    }

    @Override
    public void upgrade(User user) {
        if (!adminPolicy.isAdmin(user)) {
            delegate.upgrade(user);
        }
    }

    @Override
    public EntitlementStatus getStatus(User user) {
        if (!adminPolicy.isAdmin(user)) {
            return delegate.getStatus(user);
        }

        Map<DocumentType, QuotaUsage> perType = new EnumMap<>(DocumentType.class);
        for (DocumentType type : DocumentType.values()) {
            perType.put(type, QuotaUsage.unlimited(user.getUsed(type)));
        }
        return EntitlementStatus.builder()
                .tier(user.getTier())
                .admin(true)
                .perType(perType)
                .pdfAllowed(true)
                .build();
    }

    public boolean isAdmin(User user) {
        return adminPolicy.isAdmin(user);
    }
}
