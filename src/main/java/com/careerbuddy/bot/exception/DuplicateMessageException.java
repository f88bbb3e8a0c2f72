package com.careerbuddy.bot.exception;

public class DuplicateMessageException extends ConversationException {

    public DuplicateMessageException(Long jobId, Integer messageId) {
        super("Message " + messageId + " already processed for job " + jobId);
    }
}
