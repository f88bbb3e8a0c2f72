package com.careerbuddy.bot.service;

import com.careerbuddy.bot.constant.BotConstants;
import com.careerbuddy.bot.keyboard.MainMenuKeyboard;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Commands recognized at any step, before the current step sees the message. Matching is exact
 * and case-insensitive, so answers that merely contain a command word are left alone.
 */
public enum GlobalCommand {

    START(Set.of("/start", "start", "menu", "/menu", "hi", "hello", "hey", lower(MainMenuKeyboard.BUTTON_NEW_DOCUMENT))),
    RESET(Set.of("/reset", "reset", "restart", "start over", lower(MainMenuKeyboard.BUTTON_RESET))),
    CANCEL(Set.of("/cancel", "cancel")),
    HELP(Set.of("/help", "help", lower(MainMenuKeyboard.BUTTON_HELP))),
    STATUS(Set.of("/status", "status", lower(MainMenuKeyboard.BUTTON_STATUS))),
    PDF(Set.of("/pdf", "pdf")),
    SKIP(Set.of("/skip", "skip")),
    UPGRADE(Set.of("/upgrade", "upgrade", "premium")),
    HISTORY(Set.of("/history", "history")),
    STATS(Set.of("/stats")),
    SET_PRO(Set.of("/setpro")),
    WAKE(BotConstants.WAKE_WORDS);

    private static final String SET_PRO_PREFIX = "/setpro ";

    private final Set<String> tokens;

    GlobalCommand(Set<String> tokens) {
        this.tokens = tokens;
    }

    @NotNull
    public static Optional<GlobalCommand> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = lower(text.trim());
        if (normalized.startsWith(SET_PRO_PREFIX)) {
            return Optional.of(SET_PRO);
        }
        return Arrays.stream(values())
                .filter(command -> command.tokens.contains(normalized))
                .findFirst();
    }

    /** Argument of a "/setpro 12345" message, or an empty string. */
    @NotNull
    public static String argument(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? "" : trimmed.substring(space + 1).trim();
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
