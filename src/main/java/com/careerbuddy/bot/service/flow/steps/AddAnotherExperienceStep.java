package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.constant.MessageTemplates;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.YesNoGrammar;
import org.springframework.stereotype.Component;

@Component
public class AddAnotherExperienceStep implements StepHandler {

    private static final YesNoGrammar GRAMMAR = new YesNoGrammar();

    @Override
    public Step step() {
        return Step.ADD_ANOTHER_EXPERIENCE;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return StepResult.stay(MessageTemplates.PROMPT_ADD_ANOTHER_EXPERIENCE);
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        if (GRAMMAR.parse(input)) {
            return StepResult.moveTo(Step.EXPERIENCE_HEADER);
        }
        return StepResult.advance();
    }

    @Override
    public StepResult onSkip(StepContext ctx) {
        return StepResult.advance();
    }
}
