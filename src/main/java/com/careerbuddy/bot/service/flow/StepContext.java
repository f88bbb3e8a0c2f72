package com.careerbuddy.bot.service.flow;

import com.careerbuddy.bot.dto.AttachmentRef;
import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.Tier;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.service.ai.GenerationRequest;
import lombok.Builder;
import lombok.Getter;

/**
 * What a step handler may look at and change during one turn. Handlers mutate {@link #answers} in
 * place; the engine persists them together with the step transition.
 */
@Getter
@Builder
public class StepContext {

    private final Long jobId;
    private final DocumentType documentType;
    private final Tier tier;
    /** Pro users and admins; unlocks template selection. */
    private final boolean premium;
    private final Answers answers;
    private final AttachmentRef attachment;

    public boolean hasAttachment() {
        return attachment != null;
    }

    public GenerationRequest generationRequest() {
        return GenerationRequest.from(jobId, answers, tier, documentType);
    }
}
