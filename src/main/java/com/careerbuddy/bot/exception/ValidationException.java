package com.careerbuddy.bot.exception;

import lombok.Getter;

/**
 * Step input did not match the step's grammar. The step is not advanced.
 */
@Getter
public class ValidationException extends ConversationException {

    private final String userMessage;
    private final String example;

    public ValidationException(String userMessage, String example) {
        super(userMessage);
        this.userMessage = userMessage;
        this.example = example;
    }

    public ValidationException(String userMessage) {
        this(userMessage, null);
    }
}
