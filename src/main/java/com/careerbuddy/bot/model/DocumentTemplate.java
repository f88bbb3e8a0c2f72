package com.careerbuddy.bot.model;

import java.util.Arrays;
import java.util.Optional;

public enum DocumentTemplate {

    CLASSIC("classic", "Classic", "1"),

    MODERN("modern", "Modern", "2"),

    EXECUTIVE("executive", "Executive", "3");

    private final String code;
    private final String displayName;
    private final String number;

    DocumentTemplate(String code, String displayName, String number) {
        this.code = code;
        this.displayName = displayName;
        this.number = number;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getNumber() {
        return number;
    }

    public String getCallbackData() {
        return "template_" + code;
    }

    /** Accepts "2", "modern" or the menu callback "template_modern". */
    public static Optional<DocumentTemplate> fromInput(String input) {
        if (input == null) {
            return Optional.empty();
        }
        String token = input.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(t -> t.number.equals(token) || t.code.equals(token) || t.getCallbackData().equals(token))
                .findFirst();
    }

    public static DocumentTemplate fromCode(String code) {
        return fromInput(code).orElse(CLASSIC);
    }
}
