package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.service.flow.input.FreeTextGrammar;
import org.springframework.stereotype.Component;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

@Component
public class InterestReasonStep extends TextAnswerStep {

    public InterestReasonStep() {
        super(Step.INTEREST_REASON, PROMPT_INTEREST_REASON,
                new FreeTextGrammar(5, 1000, ERR_TEXT_REQUIRED, EXAMPLE_INTEREST_REASON));
    }

    @Override
    protected void store(Answers answers, String value) {
        answers.getCoverLetter().setInterestReason(value);
    }
}
