package com.careerbuddy.bot.exception;

public class RenderingException extends ConversationException {

    public RenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
