package com.careerbuddy.bot.service.ai;

import com.careerbuddy.bot.model.answers.Experience;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Static content used whenever the generator fails or times out.
 */
public final class FallbackContent {

    private static final List<String> DATA_SKILLS = List.of(
            "Data Analysis", "SQL", "Excel", "Python", "Problem Solving", "Communication", "Critical Thinking", "Reporting");

    private static final List<String> ENGINEERING_SKILLS = List.of(
            "Software Development", "Problem Solving", "Git", "Testing", "Code Review", "Teamwork", "Communication", "Agile");

    private static final List<String> MARKETING_SKILLS = List.of(
            "Digital Marketing", "Content Creation", "SEO", "Analytics", "Communication", "Creativity", "Project Management", "Social Media");

    private static final List<String> SALES_SKILLS = List.of(
            "Sales Strategy", "Client Relations", "Negotiation", "CRM", "Communication", "Presentation", "Teamwork", "Goal-Oriented");

    private static final List<String> GENERAL_SKILLS = List.of(
            "Communication", "Problem Solving", "Teamwork", "Leadership", "Time Management", "Adaptability", "Critical Thinking", "Organization");

    private FallbackContent() {
    }

    @NotNull
    public static List<String> skills(String targetRole) {
        String role = targetRole == null ? "" : targetRole.toLowerCase();
        if (role.contains("data") || role.contains("analyst")) {
            return DATA_SKILLS;
        }
        if (role.contains("engineer") || role.contains("developer")) {
            return ENGINEERING_SKILLS;
        }
        if (role.contains("marketing")) {
            return MARKETING_SKILLS;
        }
        if (role.contains("sales")) {
            return SALES_SKILLS;
        }
        return GENERAL_SKILLS;
    }

    @NotNull
    public static String summary(@NotNull GenerationRequest request) {
        String title = request.getTargetRole() == null || request.getTargetRole().isBlank()
                ? "Professional"
                : capitalize(request.getTargetRole().trim());

        String company = request.getExperiences().isEmpty() ? null : firstCompany(request.getExperiences());
        StringBuilder sb = new StringBuilder(title).append(" with hands-on experience");
        if (company != null) {
            sb.append(" at ").append(company);
        }
        sb.append(". ");

        if (request.getSkills().isEmpty()) {
            sb.append("Delivering reliable results and clean execution.");
        } else {
            sb.append("Skilled in ").append(String.join(", ", request.getSkills().subList(0, Math.min(3, request.getSkills().size())))).append('.');
        }
        return sb.toString();
    }

    /** Without the generator the resume goes through unchanged. */
    @NotNull
    public static String revamp(@NotNull GenerationRequest request) {
        return request.getOriginalContent() == null ? "" : request.getOriginalContent();
    }

    private static String firstCompany(List<Experience> experiences) {
        String company = experiences.get(0).getCompany();
        return company == null || company.isBlank() ? null : company.trim();
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
