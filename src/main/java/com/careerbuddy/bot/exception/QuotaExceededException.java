package com.careerbuddy.bot.exception;

import com.careerbuddy.bot.model.DocumentType;
import lombok.Getter;

@Getter
public class QuotaExceededException extends ConversationException {

    private final DocumentType documentType;
    private final int limit;

    public QuotaExceededException(DocumentType documentType, int limit) {
        super("Quota exceeded for " + documentType + " (limit " + limit + ")");
        this.documentType = documentType;
        this.limit = limit;
    }
}
