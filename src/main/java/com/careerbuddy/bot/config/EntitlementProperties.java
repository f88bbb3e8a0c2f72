package com.careerbuddy.bot.config;

import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.Tier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Tier limit table and admin identities. Loaded under the 'entitlements' prefix; the defaults
 * below are the production limits.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "entitlements")
public class EntitlementProperties {

    private int cycleDays = 30;

    private Set<Long> adminIds = new HashSet<>();

    private Map<Tier, TierLimits> tiers = defaultTiers();

    public int limitFor(Tier tier, DocumentType type) {
        TierLimits limits = tiers.get(tier);
        if (limits == null) {
            return 0;
        }
        return limits.getLimits().getOrDefault(type, 0);
    }

    public boolean isPdfAllowed(Tier tier) {
        TierLimits limits = tiers.get(tier);
        return limits != null && limits.isPdfAllowed();
    }

    public static EntitlementProperties defaults() {
        return new EntitlementProperties();
    }

    private static Map<Tier, TierLimits> defaultTiers() {
        Map<Tier, TierLimits> tiers = new EnumMap<>(Tier.class);
        tiers.put(Tier.FREE, TierLimits.of(1, 1, 0, 1, false));
        tiers.put(Tier.PRO, TierLimits.of(2, 2, 1, 1, true));
        return tiers;
    }

    @Data
    public static class TierLimits {

        private Map<DocumentType, Integer> limits = new EnumMap<>(DocumentType.class);

        private boolean pdfAllowed;

        static TierLimits of(int resume, int cv, int coverLetter, int revamp, boolean pdfAllowed) {
            TierLimits tierLimits = new TierLimits();
            tierLimits.limits.put(DocumentType.RESUME, resume);
            tierLimits.limits.put(DocumentType.CV, cv);
            tierLimits.limits.put(DocumentType.COVER_LETTER, coverLetter);
            tierLimits.limits.put(DocumentType.REVAMP, revamp);
            tierLimits.pdfAllowed = pdfAllowed;
            return tierLimits;
        }
    }
}
