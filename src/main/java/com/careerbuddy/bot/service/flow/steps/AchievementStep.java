package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.service.flow.input.FreeTextGrammar;

import static com.careerbuddy.bot.constant.MessageTemplates.ERR_TEXT_REQUIRED;
import static com.careerbuddy.bot.constant.MessageTemplates.EXAMPLE_ACHIEVEMENT;

/**
 * The achievement questions of a cover letter.
 */
public abstract class AchievementStep extends TextAnswerStep {

    private static final FreeTextGrammar GRAMMAR = new FreeTextGrammar(5, 1000, ERR_TEXT_REQUIRED, EXAMPLE_ACHIEVEMENT);

    protected AchievementStep(Step step, String prompt) {
        super(step, prompt, GRAMMAR);
    }
}
