package com.careerbuddy.bot.service.entitlement;

import com.careerbuddy.bot.exception.ConversationException;
import com.careerbuddy.bot.exception.EntitlementDeniedException;
import com.careerbuddy.bot.exception.QuotaExceededException;
import com.careerbuddy.bot.model.DocumentType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GenerationDecision {

    public enum DenialReason {
        NONE,
        NOT_ALLOWED,
        QUOTA_EXCEEDED
    }

    private final boolean allowed;
    private final DenialReason reason;
    private final DocumentType documentType;
    private final int limit;

    public static GenerationDecision allow(DocumentType type, int limit) {
        return new GenerationDecision(true, DenialReason.NONE, type, limit);
    }

    public static GenerationDecision notAllowed(DocumentType type) {
        return new GenerationDecision(false, DenialReason.NOT_ALLOWED, type, 0);
    }

    public static GenerationDecision quotaExceeded(DocumentType type, int limit) {
        return new GenerationDecision(false, DenialReason.QUOTA_EXCEEDED, type, limit);
    }

    public ConversationException toException() {
        return switch (reason) {
            case NOT_ALLOWED -> new EntitlementDeniedException(documentType.getDisplayName());
            case QUOTA_EXCEEDED -> new QuotaExceededException(documentType, limit);
            case NONE -> throw new IllegalStateException("Generation is allowed");
        };
    }
}
