package com.careerbuddy.bot.service;

import com.careerbuddy.bot.dto.InboundMessage;
import com.careerbuddy.bot.dto.ResponseDirective;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import static com.careerbuddy.bot.constant.MessageTemplates.GENERIC_ERROR;

/**
 * Entry point for the chat transport. Runs each turn in its own transaction and turns every
 * failure that is not a user error into the generic apology.
 */
@Service
public class InboundMessageHandler {

    private static final Logger log = LoggerFactory.getLogger(InboundMessageHandler.class);

    private final ConversationService conversationService;

    @Autowired
    public InboundMessageHandler(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @NotNull
    public ResponseDirective handle(@NotNull InboundMessage message) {
        try {
            return process(message);
        } catch (ObjectOptimisticLockingFailureException e) {
            // the replay sees the other turn's message id, so a racing duplicate becomes a no-op
            log.warn("Concurrent update for user {}, retrying message {}", message.getUserId(), message.getMessageId());
            try {
                return process(message);
            } catch (RuntimeException retryFailure) {
                return failure(message, retryFailure);
            }
        } catch (RuntimeException e) {
            return failure(message, e);
        }
    }

    public void markDelivered(@NotNull Long jobId) {
        try {
            conversationService.markDelivered(jobId);
        } catch (DataAccessException e) {
            log.error("Could not mark job {} delivered: {}", jobId, e.getMessage(), e);
        }
    }

    private ResponseDirective process(InboundMessage message) {
        return conversationService.handleInbound(message);
    }

    private ResponseDirective failure(InboundMessage message, RuntimeException e) {
        if (e instanceof DataAccessException) {
            log.error("Persistence failure for user {} message {}: {}",
                    message.getUserId(), message.getMessageId(), e.getMessage(), e);
        } else {
            log.error("Unexpected failure for user {} message {}: {}",
                    message.getUserId(), message.getMessageId(), e.getMessage(), e);
        }
        return ResponseDirective.text(GENERIC_ERROR);
    }
}
