package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.service.flow.input.FreeTextGrammar;
import org.springframework.stereotype.Component;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

@Component
public class TargetRoleStep extends TextAnswerStep {

    public TargetRoleStep() {
        super(Step.TARGET_ROLE, PROMPT_TARGET_ROLE, new FreeTextGrammar(2, 100, ERR_TARGET_ROLE, EXAMPLE_TARGET_ROLE));
    }

    @Override
    protected void store(Answers answers, String value) {
        answers.setTargetRole(value);
    }
}
