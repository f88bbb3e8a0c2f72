package com.careerbuddy.bot.constant;

import java.util.Set;

public class BotConstants {

    public static final String PAYMENT_SUCCESS = "success";

    public static final String PAYMENT_PENDING = "pending";

    public static final String PAYMENT_FAILED = "failed";

    public static final String EVENT_CHARGE_SUCCESS = "charge.success";

    public static final int MAX_MESSAGE_LENGTH = 4096; // Telegram Bot API limit

    public static final int MAX_BULLETS_PER_EXPERIENCE = 6;

    public static final int MIN_SKILLS = 3;

    public static final int MAX_SELECTED_SKILLS = 5;

    public static final int MAX_SUGGESTED_SKILLS = 8;

    public static final int MIN_PASTED_RESUME_LENGTH = 150;

    public static final int MAX_ATTACHMENT_BYTES = 10 * 1024 * 1024;

    public static final int PREVIEW_EXCERPT_LENGTH = 500;

    public static final int HISTORY_SIZE = 5;

    public static final String DEFAULT_TEMPLATE = "classic";

    public static final Set<String> YES_WORDS = Set.of("yes", "y", "yeah", "yep", "sure", "confirm", "add", "add another");

    public static final Set<String> NO_WORDS = Set.of("no", "n", "nope", "done", "skip");

    public static final Set<String> LOOP_TERMINATORS = Set.of("done", "no", "skip", "finish");

    public static final Set<String> WAKE_WORDS = Set.of("continue", "ready", "show", "generate", "next", "proceed", "go", "ok");

    private BotConstants() {
    }
}
