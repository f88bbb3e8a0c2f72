package com.careerbuddy.bot.model.answers;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything a user has told the assistant for one job. Filled in step by step, so any field may be
 * missing until the conversation reaches it.
 */
@Data
@NoArgsConstructor
public class Answers implements Serializable {

    private Basics basics = new Basics();

    private String targetRole;

    private List<Experience> experiences = new ArrayList<>();

    private List<Education> education = new ArrayList<>();

    private List<String> certifications = new ArrayList<>();

    private List<Profile> profiles = new ArrayList<>();

    private List<String> projects = new ArrayList<>();

    private List<String> skills = new ArrayList<>();

    private List<String> aiSuggestedSkills = new ArrayList<>();

    private String personalInfo;

    private String summary;

    private String aiSummary;

    private CoverLetter coverLetter = new CoverLetter();

    private String originalContent;

    private String revampedContent;

    private String template;

    public Experience lastExperience() {
        return experiences.isEmpty() ? null : experiences.get(experiences.size() - 1);
    }

    /** Role the document is aimed at, whichever flow collected it. */
    public String effectiveRole() {
        if (targetRole != null && !targetRole.isBlank()) {
            return targetRole;
        }
        if (coverLetter.getRole() != null && !coverLetter.getRole().isBlank()) {
            return coverLetter.getRole();
        }
        Experience latest = lastExperience();
        return latest != null ? latest.getRole() : null;
    }
}
