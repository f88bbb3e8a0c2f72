package com.careerbuddy.bot.service;

import com.careerbuddy.bot.exception.DuplicateMessageException;
import com.careerbuddy.bot.model.Job;
import org.jetbrains.annotations.NotNull;
import org.springframework.stereotype.Component;

/**
 * Drops redelivered messages per job. The processed id is written in the same transaction as the
 * step transition, and the job's version column turns two racing deliveries into one commit and
 * one optimistic lock failure.
 */
@Component
public class IdempotencyFilter {

    public boolean isDuplicate(@NotNull Job job, Integer messageId) {
        return messageId != null && messageId.equals(job.getLastMessageId());
    }

    /**
     * Must run before anything is mutated.
     *
     * @throws DuplicateMessageException when the job already processed this message
     */
    public void verify(@NotNull Job job, Integer messageId) {
        if (isDuplicate(job, messageId)) {
            throw new DuplicateMessageException(job.getId(), messageId);
        }
    }

    /** Called once the turn completed; a failed turn leaves the previous id so the message can be replayed. */
    public void markProcessed(@NotNull Job job, Integer messageId) {
        if (messageId != null) {
            job.setLastMessageId(messageId);
        }
    }
}
