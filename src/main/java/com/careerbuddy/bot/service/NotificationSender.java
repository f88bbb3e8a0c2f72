package com.careerbuddy.bot.service;

import org.jetbrains.annotations.NotNull;

/**
 * Pushes a message to a user outside of a conversational turn.
 */
public interface NotificationSender {

    /** Delivery failures are logged, never thrown. */
    void notify(@NotNull Long telegramId, @NotNull String text);
}
