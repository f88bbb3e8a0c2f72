package com.careerbuddy.bot.service.ai;

import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.Tier;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.model.answers.AnswersConverter;
import com.careerbuddy.bot.model.answers.Experience;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Immutable input for one content generation call. Built from a copy of the answers, so a running
 * generation never sees later edits.
 */
@Getter
@Builder
@ToString(exclude = "originalContent")
public class GenerationRequest {

    private final Long jobId;
    private final Tier tier;
    private final DocumentType documentType;
    private final String name;
    private final String targetRole;
    private final List<Experience> experiences;
    private final List<String> skills;
    private final String personalInfo;
    private final String originalContent;

    public static GenerationRequest from(Long jobId, Answers answers, Tier tier, DocumentType documentType) {
        Answers snapshot = AnswersConverter.copyOf(answers);
        return GenerationRequest.builder()
                .jobId(jobId)
                .tier(tier)
                .documentType(documentType)
                .name(snapshot.getBasics().getName())
                .targetRole(snapshot.effectiveRole())
                .experiences(List.copyOf(snapshot.getExperiences()))
                .skills(List.copyOf(snapshot.getSkills()))
                .personalInfo(snapshot.getPersonalInfo())
                .originalContent(snapshot.getOriginalContent())
                .build();
    }

    public boolean isPro() {
        return tier == Tier.PRO;
    }
}
