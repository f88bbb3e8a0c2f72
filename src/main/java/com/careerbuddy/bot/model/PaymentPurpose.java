package com.careerbuddy.bot.model;

import java.util.Optional;

/**
 * What a payment pays for: the premium package or a single extra document of one type.
 */
public final class PaymentPurpose {

    public static final String PREMIUM_UPGRADE = "premium_upgrade";

    private PaymentPurpose() {
    }

    public static String forDocument(DocumentType type) {
        return type.getCode();
    }

    public static boolean isPremiumUpgrade(String purpose) {
        return PREMIUM_UPGRADE.equals(purpose);
    }

    public static Optional<DocumentType> documentType(String purpose) {
        return DocumentType.fromCode(purpose);
    }
}
