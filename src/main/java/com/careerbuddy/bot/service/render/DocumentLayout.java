package com.careerbuddy.bot.service.render;

import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.model.answers.Basics;
import com.careerbuddy.bot.model.answers.CoverLetter;
import com.careerbuddy.bot.model.answers.Education;
import com.careerbuddy.bot.model.answers.Experience;
import com.careerbuddy.bot.model.answers.Profile;
import com.careerbuddy.bot.service.render.LayoutLine.Kind;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Format independent line model of a document. Renderers decide how each {@link Kind} looks.
 */
public final class DocumentLayout {

    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[<>:\"/\\\\|?*]");

    private static final Pattern BULLET_LINE = Pattern.compile("^\\s*[•\\-*]\\s+(.*)$");

    private DocumentLayout() {
    }

    @NotNull
    public static List<LayoutLine> build(@NotNull RenderRequest request) {
        Answers answers = request.getAnswers();
        return switch (request.getDocumentType()) {
            case RESUME, CV -> resume(request.getDocumentType(), answers);
            case COVER_LETTER -> coverLetter(answers);
            case REVAMP -> revamp(answers);
        };
    }

    /** "Jane Doe - Resume" with characters that are not allowed in file names removed. */
    @NotNull
    public static String fileName(@NotNull RenderRequest request, @NotNull String extension) {
        String name = request.getAnswers().getBasics().getName();
        String base = (isBlank(name) ? "CareerBuddy" : name.trim()) + " - " + request.getDocumentType().getDisplayName();
        return UNSAFE_FILE_CHARS.matcher(base).replaceAll("").trim() + "." + extension;
    }

    private static List<LayoutLine> resume(DocumentType type, Answers answers) {
        List<LayoutLine> lines = new ArrayList<>();
        header(lines, answers.getBasics(), answers.getTargetRole());

        section(lines, "Professional Summary");
        text(lines, answers.getSummary());

        if (!answers.getSkills().isEmpty()) {
            section(lines, "Skills");
            text(lines, String.join(" • ", answers.getSkills()));
        }

        if (!answers.getExperiences().isEmpty()) {
            section(lines, "Work Experience");
            for (Experience exp : answers.getExperiences()) {
                text(lines, experienceTitle(exp));
                String dates = joinNonBlank(" - ", exp.getStart(), exp.getEnd());
                if (!dates.isEmpty()) {
                    lines.add(new LayoutLine(Kind.SUBTITLE, dates));
                }
                exp.getBullets().forEach(b -> lines.add(new LayoutLine(Kind.BULLET, b)));
            }
        }

        if (!answers.getEducation().isEmpty()) {
            section(lines, "Education");
            for (Education edu : answers.getEducation()) {
                String year = isBlank(edu.getYear()) ? "" : " (" + edu.getYear() + ")";
                text(lines, joinNonBlank(", ", edu.getDegree(), edu.getSchool()) + year);
            }
        }

        bulletSection(lines, "Certifications", answers.getCertifications());
        bulletSection(lines, "Projects", answers.getProjects());

        if (!answers.getProfiles().isEmpty()) {
            section(lines, "Profiles");
            for (Profile profile : answers.getProfiles()) {
                text(lines, profile.getPlatform() + ": " + profile.getUrl());
            }
        }

        if (type == DocumentType.CV && !isBlank(answers.getPersonalInfo())) {
            section(lines, "Personal Profile");
            text(lines, answers.getPersonalInfo());
        }
        return lines;
    }

    private static List<LayoutLine> coverLetter(Answers answers) {
        CoverLetter cover = answers.getCoverLetter();
        List<LayoutLine> lines = new ArrayList<>();
        header(lines, answers.getBasics(), null);
        lines.add(LayoutLine.blank());

        text(lines, "Dear Hiring Manager,");
        lines.add(LayoutLine.blank());
        text(lines, String.format("I am writing to apply for the %s position at %s. With %s of experience in %s, "
                        + "I am confident I can make a meaningful contribution to your team.",
                cover.getRole(), cover.getCompany(), orDefault(cover.getYearsExperience(), "several years"),
                orDefault(cover.getIndustries(), "my field")));
        lines.add(LayoutLine.blank());

        if (!isBlank(cover.getInterestReason())) {
            text(lines, cover.getInterestReason());
            lines.add(LayoutLine.blank());
        }

        if (!isBlank(cover.getCurrentTitle())) {
            text(lines, String.format("In my current role as %s at %s, my results include:",
                    cover.getCurrentTitle(), orDefault(cover.getCurrentEmployer(), "my current employer")));
        } else {
            text(lines, "Highlights of my recent work include:");
        }
        Stream.of(cover.getAchievement1(), cover.getAchievement2())
                .filter(a -> !isBlank(a))
                .forEach(a -> lines.add(new LayoutLine(Kind.BULLET, a)));
        lines.add(LayoutLine.blank());

        if (!cover.getKeySkills().isEmpty()) {
            text(lines, "My key strengths include " + humanJoin(cover.getKeySkills()) + ".");
            lines.add(LayoutLine.blank());
        }

        text(lines, String.format("I would welcome the opportunity to help %s with %s. "
                + "Thank you for considering my application.", cover.getCompany(), lowerFirst(cover.getCompanyGoal())));
        lines.add(LayoutLine.blank());
        text(lines, "Sincerely,");
        text(lines, answers.getBasics().getName());
        return lines;
    }

    private static List<LayoutLine> revamp(Answers answers) {
        List<LayoutLine> lines = new ArrayList<>();
        String content = answers.getRevampedContent() != null ? answers.getRevampedContent() : answers.getOriginalContent();
        if (content == null) {
            return lines;
        }
        for (String raw : content.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) {
                lines.add(LayoutLine.blank());
                continue;
            }
            Matcher bullet = BULLET_LINE.matcher(line);
            if (bullet.matches()) {
                lines.add(new LayoutLine(Kind.BULLET, bullet.group(1)));
            } else if (isHeading(line)) {
                lines.add(new LayoutLine(Kind.HEADING, line));
            } else {
                text(lines, line);
            }
        }
        return lines;
    }

    private static void header(List<LayoutLine> lines, Basics basics, String subtitle) {
        lines.add(new LayoutLine(Kind.NAME, orDefault(basics.getName(), "")));
        if (!isBlank(subtitle)) {
            lines.add(new LayoutLine(Kind.SUBTITLE, subtitle));
        }
        String contact = joinNonBlank(" | ", basics.getEmail(), basics.getPhone(), basics.getLocation());
        if (!contact.isEmpty()) {
            text(lines, contact);
        }
    }

    private static void section(List<LayoutLine> lines, String title) {
        lines.add(LayoutLine.blank());
        lines.add(new LayoutLine(Kind.HEADING, title));
    }

    private static void bulletSection(List<LayoutLine> lines, String title, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        section(lines, title);
        items.forEach(item -> lines.add(new LayoutLine(Kind.BULLET, item)));
    }

    private static void text(List<LayoutLine> lines, String value) {
        if (!isBlank(value)) {
            lines.add(new LayoutLine(Kind.TEXT, value));
        }
    }

    private static String experienceTitle(Experience exp) {
        String title = joinNonBlank(" - ", exp.getRole(), exp.getCompany());
        return isBlank(exp.getCity()) ? title : title + ", " + exp.getCity();
    }

    /** Short all-caps lines such as "EXPERIENCE" or "SKILLS". */
    private static boolean isHeading(String line) {
        return line.length() <= 40 && line.chars().anyMatch(Character::isLetter) && line.equals(line.toUpperCase());
    }

    private static String humanJoin(List<String> items) {
        if (items.size() == 1) {
            return items.get(0);
        }
        return String.join(", ", items.subList(0, items.size() - 1)) + " and " + items.get(items.size() - 1);
    }

    private static String joinNonBlank(String separator, String... parts) {
        return Stream.of(parts)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .collect(Collectors.joining(separator));
    }

    private static String lowerFirst(String value) {
        if (isBlank(value)) {
            return "its goals";
        }
        return Character.toLowerCase(value.charAt(0)) + value.substring(1);
    }

    private static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
