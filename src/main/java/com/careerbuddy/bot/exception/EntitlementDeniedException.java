package com.careerbuddy.bot.exception;

import lombok.Getter;

/**
 * A document type or feature is not part of the user's tier at all.
 */
@Getter
public class EntitlementDeniedException extends ConversationException {

    private final String feature;

    public EntitlementDeniedException(String feature) {
        super(feature + " is not available on the current tier");
        this.feature = feature;
    }
}
