package com.careerbuddy.bot.service.entitlement;

import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.Tier;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Snapshot of a user's entitlements. For admins every usage is unlimited and both instants are null.
 */
@Getter
@Builder
@ToString
public class EntitlementStatus {

    private final Tier tier;
    private final boolean admin;
    private final Map<DocumentType, QuotaUsage> perType;
    private final boolean pdfAllowed;
    private final LocalDateTime quotaResetAt;
    private final LocalDateTime premiumExpiresAt;

    public QuotaUsage usage(DocumentType type) {
        return perType.get(type);
    }
}
