package com.careerbuddy.bot.model;

/**
 * Identifiers of every conversational step. The order a document type walks them in is defined by
 * {@code StepTable}; this enum only carries per-step traits.
 */
public enum Step {

    BASICS,
    TARGET_ROLE,
    EXPERIENCE_HEADER(true),
    EXPERIENCE_BULLETS,
    ADD_ANOTHER_EXPERIENCE,
    EDUCATION(true),
    CERTIFICATIONS(true),
    PROFILES(true),
    PROJECTS(true),
    SKILLS,
    PERSONAL_INFO(true),
    SUMMARY,

    ROLE_COMPANY,
    EXPERIENCE_OVERVIEW,
    INTEREST_REASON,
    CURRENT_ROLE,
    ACHIEVEMENT_1,
    ACHIEVEMENT_2(true),
    KEY_SKILLS,
    COMPANY_GOAL,

    UPLOAD,
    REVAMP_REVIEW,

    PREVIEW,
    TEMPLATE_SELECTION,
    FINALIZE,
    DONE;

    private final boolean skippable;

    Step() {
        this(false);
    }

    Step(boolean skippable) {
        this.skippable = skippable;
    }

    public boolean isSkippable() {
        return skippable;
    }

    /** Steps at which the collected data is frozen and shown back to the user. */
    public boolean isPreviewPhase() {
        return this == PREVIEW || this == TEMPLATE_SELECTION || this == FINALIZE;
    }
}
