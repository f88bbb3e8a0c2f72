package com.careerbuddy.bot.exception;

/**
 * Base type for failures raised while processing one conversational turn.
 */
public class ConversationException extends RuntimeException {

    public ConversationException(String message) {
        super(message);
    }

    public ConversationException(String message, Throwable cause) {
        super(message, cause);
    }
}
