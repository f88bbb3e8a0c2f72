package com.careerbuddy.bot.exception;

public class UpstreamGenerationException extends ConversationException {

    public UpstreamGenerationException(String message) {
        super(message);
    }

    public UpstreamGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
