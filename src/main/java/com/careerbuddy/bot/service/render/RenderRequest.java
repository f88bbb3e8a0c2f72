package com.careerbuddy.bot.service.render;

import com.careerbuddy.bot.model.DocumentTemplate;
import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.answers.Answers;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString(exclude = "answers")
public class RenderRequest {

    private final Long jobId;
    private final DocumentType documentType;
    private final DocumentTemplate template;
    private final Answers answers;
}
