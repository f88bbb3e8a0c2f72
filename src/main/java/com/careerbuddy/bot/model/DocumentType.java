package com.careerbuddy.bot.model;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

public enum DocumentType {

    RESUME("resume", "Resume", Set.of("resume", "/resume", "choose_resume")),

    CV("cv", "CV", Set.of("cv", "/cv", "choose_cv")),

    COVER_LETTER("cover_letter", "Cover Letter",
            Set.of("cover letter", "cover_letter", "cover", "/cover", "choose_cover")),

    REVAMP("revamp", "Revamp", Set.of("revamp", "/revamp", "choose_revamp"));

    private final String code;
    private final String displayName;
    private final Set<String> selectionTokens;

    DocumentType(String code, String displayName, Set<String> selectionTokens) {
        this.code = code;
        this.displayName = displayName;
        this.selectionTokens = selectionTokens;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Matches an exact menu selection ("resume", "/cv", "choose_cover"...). Free text that merely
     * mentions a document type is not a selection.
     */
    @NotNull
    public static Optional<DocumentType> fromSelection(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String token = text.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(type -> type.selectionTokens.contains(token))
                .findFirst();
    }

    @NotNull
    public static Optional<DocumentType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(type -> type.code.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return displayName;
    }
}
