package com.careerbuddy.bot.service.flow;

import com.careerbuddy.bot.constant.BotConstants;
import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.model.answers.Basics;
import com.careerbuddy.bot.model.answers.CoverLetter;
import com.careerbuddy.bot.model.answers.Experience;
import org.jetbrains.annotations.NotNull;

import java.util.List;

import static com.careerbuddy.bot.util.MessageUtils.escapeHtml;
import static com.careerbuddy.bot.util.MessageUtils.truncate;

/**
 * Chat preview of the collected answers.
 */
public final class PreviewFormatter {

    private static final String NOT_SET = "N/A";

    private PreviewFormatter() {
    }

    @NotNull
    public static String format(@NotNull DocumentType type, @NotNull Answers answers) {
        return switch (type) {
            case RESUME, CV -> formatResume(type, answers);
            case COVER_LETTER -> formatCoverLetter(answers);
            case REVAMP -> formatRevamp(answers);
        };
    }

    private static String formatResume(DocumentType type, Answers answers) {
        StringBuilder sb = new StringBuilder();
        sb.append("📋 <b>").append(type.getDisplayName()).append(" Preview</b>\n\n");
        appendContact(sb, answers.getBasics());
        if (answers.getTargetRole() != null) {
            sb.append("Target Role: ").append(escapeHtml(answers.getTargetRole())).append('\n');
        }
        sb.append('\n');

        if (answers.getSummary() != null) {
            sb.append("<b>Professional Summary:</b>\n").append(escapeHtml(answers.getSummary())).append("\n\n");
        }
        if (!answers.getSkills().isEmpty()) {
            sb.append("<b>Skills:</b>\n").append(escapeHtml(String.join(", ", answers.getSkills()))).append("\n\n");
        }

        List<Experience> experiences = answers.getExperiences();
        if (!experiences.isEmpty()) {
            sb.append("<b>Work Experience:</b> (").append(plural(experiences.size(), "position")).append(")\n");
            for (int i = 0; i < experiences.size(); i++) {
                Experience exp = experiences.get(i);
                sb.append(i + 1).append(". ").append(escapeHtml(exp.getRole()))
                        .append(" at ").append(escapeHtml(exp.getCompany()))
                        .append(" (").append(plural(exp.getBullets().size(), "achievement")).append(")\n");
            }
            sb.append('\n');
        }
        if (!answers.getEducation().isEmpty()) {
            sb.append("<b>Education:</b> ").append(plural(answers.getEducation().size(), "entry")).append('\n');
        }
        if (!answers.getCertifications().isEmpty()) {
            sb.append("<b>Certifications:</b> ").append(plural(answers.getCertifications().size(), "item")).append('\n');
        }
        if (!answers.getProfiles().isEmpty()) {
            sb.append("<b>Profiles:</b> ").append(plural(answers.getProfiles().size(), "link")).append('\n');
        }
        if (!answers.getProjects().isEmpty()) {
            sb.append("<b>Projects:</b> ").append(plural(answers.getProjects().size(), "item")).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private static String formatCoverLetter(Answers answers) {
        CoverLetter cover = answers.getCoverLetter();
        StringBuilder sb = new StringBuilder("📋 <b>Cover Letter Preview</b>\n\n");
        appendContact(sb, answers.getBasics());
        sb.append('\n');
        sb.append("<b>Target Position:</b>\n")
                .append(value(cover.getRole())).append(" at ").append(value(cover.getCompany())).append("\n\n");
        sb.append("<b>Experience:</b>\n")
                .append(value(cover.getYearsExperience())).append(" in ").append(value(cover.getIndustries())).append('\n')
                .append("Current: ").append(value(cover.getCurrentTitle()))
                .append(" at ").append(value(cover.getCurrentEmployer())).append("\n\n");
        sb.append("<b>Key Achievements:</b>\n").append(value(cover.getAchievement1())).append('\n');
        if (cover.getAchievement2() != null) {
            sb.append(escapeHtml(cover.getAchievement2())).append('\n');
        }
        sb.append('\n');
        sb.append("<b>Key Skills:</b>\n")
                .append(cover.getKeySkills().isEmpty() ? NOT_SET : escapeHtml(String.join(", ", cover.getKeySkills())));
        return sb.toString();
    }

    private static String formatRevamp(Answers answers) {
        String revamped = answers.getRevampedContent() == null ? NOT_SET : answers.getRevampedContent();
        return "📋 <b>Revamped Resume Preview</b>\n\n"
                + escapeHtml(truncate(revamped, BotConstants.PREVIEW_EXCERPT_LENGTH));
    }

    private static void appendContact(StringBuilder sb, Basics basics) {
        sb.append("<b>Contact Details:</b>\n");
        sb.append("Name: ").append(value(basics.getName())).append('\n');
        sb.append("Email: ").append(value(basics.getEmail())).append('\n');
        sb.append("Phone: ").append(value(basics.getPhone())).append('\n');
        sb.append("Location: ").append(value(basics.getLocation())).append('\n');
    }

    private static String value(String value) {
        return value == null || value.isBlank() ? NOT_SET : escapeHtml(value);
    }

    private static String plural(int count, String noun) {
        if (count == 1) {
            return count + " " + noun;
        }
        if (noun.endsWith("y")) {
            return count + " " + noun.substring(0, noun.length() - 1) + "ies";
        }
        return count + " " + noun + "s";
    }
}
