package com.careerbuddy.bot.service.flow;

import com.careerbuddy.bot.constant.BotConstants;
import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.model.answers.CoverLetter;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Fields a document cannot be previewed or generated without.
 */
public final class DocumentRequirements {

    private DocumentRequirements() {
    }

    @NotNull
    public static List<String> missingFields(@NotNull DocumentType type, @NotNull Answers answers) {
        List<String> missing = new ArrayList<>();
        switch (type) {
            case RESUME, CV -> {
                requireText(missing, "name", answers.getBasics().getName());
                requireText(missing, "email", answers.getBasics().getEmail());
                requireText(missing, "target role", answers.getTargetRole());
                if (answers.getSkills().size() < BotConstants.MIN_SKILLS) {
                    missing.add("skills");
                }
                requireText(missing, "summary", answers.getSummary());
            }
            case COVER_LETTER -> {
                CoverLetter cover = answers.getCoverLetter();
                requireText(missing, "name", answers.getBasics().getName());
                requireText(missing, "email", answers.getBasics().getEmail());
                requireText(missing, "role", cover.getRole());
                requireText(missing, "company", cover.getCompany());
                requireText(missing, "achievement", cover.getAchievement1());
                if (cover.getKeySkills().isEmpty()) {
                    missing.add("key skills");
                }
                requireText(missing, "company goal", cover.getCompanyGoal());
            }
            case REVAMP -> {
                requireText(missing, "original resume", answers.getOriginalContent());
                requireText(missing, "revamped resume", answers.getRevampedContent());
            }
        }
        return missing;
    }

    public static boolean isComplete(@NotNull DocumentType type, @NotNull Answers answers) {
        return missingFields(type, answers).isEmpty();
    }

    private static void requireText(List<String> missing, String field, String value) {
        if (value == null || value.isBlank()) {
            missing.add(field);
        }
    }
}
