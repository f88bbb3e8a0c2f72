package com.careerbuddy.bot.service.flow;

import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.Step;
import org.jetbrains.annotations.NotNull;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.careerbuddy.bot.model.Step.*;

/**
 * Ordered step sequence of every document type.
 */
public final class StepTable {

    private static final List<Step> RESUME_STEPS = List.of(
            BASICS, TARGET_ROLE, EXPERIENCE_HEADER, EXPERIENCE_BULLETS, ADD_ANOTHER_EXPERIENCE,
            EDUCATION, CERTIFICATIONS, PROFILES, PROJECTS, SKILLS, PERSONAL_INFO, SUMMARY,
            PREVIEW, TEMPLATE_SELECTION, FINALIZE, DONE);

    private static final List<Step> COVER_LETTER_STEPS = List.of(
            BASICS, ROLE_COMPANY, EXPERIENCE_OVERVIEW, INTEREST_REASON, CURRENT_ROLE,
            ACHIEVEMENT_1, ACHIEVEMENT_2, KEY_SKILLS, COMPANY_GOAL,
            PREVIEW, TEMPLATE_SELECTION, FINALIZE, DONE);

    private static final List<Step> REVAMP_STEPS = List.of(
            UPLOAD, REVAMP_REVIEW, PREVIEW, TEMPLATE_SELECTION, FINALIZE, DONE);

    private static final Map<DocumentType, List<Step>> SEQUENCES = new EnumMap<>(DocumentType.class);

    static {
        SEQUENCES.put(DocumentType.RESUME, RESUME_STEPS);
        SEQUENCES.put(DocumentType.CV, RESUME_STEPS);
        SEQUENCES.put(DocumentType.COVER_LETTER, COVER_LETTER_STEPS);
        SEQUENCES.put(DocumentType.REVAMP, REVAMP_STEPS);
    }

    private StepTable() {
    }

    @NotNull
    public static List<Step> sequence(@NotNull DocumentType type) {
        return SEQUENCES.get(type);
    }

    @NotNull
    public static Step first(@NotNull DocumentType type) {
        return sequence(type).get(0);
    }

    public static boolean contains(@NotNull DocumentType type, Step step) {
        return sequence(type).contains(step);
    }

    /**
     * Step following {@code current}. Template selection is only offered to premium users.
     */
    @NotNull
    public static Step next(@NotNull DocumentType type, @NotNull Step current, boolean premium) {
        List<Step> steps = sequence(type);
        int index = steps.indexOf(current);
        if (index < 0) {
            throw new IllegalStateException(current + " is not a step of " + type);
        }
        if (index == steps.size() - 1) {
            return current;
        }
        Step next = steps.get(index + 1);
        if (next == TEMPLATE_SELECTION && !premium) {
            return steps.get(index + 2);
        }
        return next;
    }

    /** Number of data collecting steps, i.e. everything before the preview. */
    public static int collectionSize(@NotNull DocumentType type) {
        return sequence(type).indexOf(PREVIEW);
    }

    /** 1-based position of a collecting step, or 0 once the preview is reached. */
    public static int position(@NotNull DocumentType type, @NotNull Step step) {
        int index = sequence(type).indexOf(step);
        if (index < 0 || index >= collectionSize(type)) {
            return 0;
        }
        return index + 1;
    }
}
