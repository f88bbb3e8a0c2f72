package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.service.flow.input.FreeTextGrammar;
import org.springframework.stereotype.Component;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

@Component
public class PersonalInfoStep extends TextAnswerStep {

    public PersonalInfoStep() {
        super(Step.PERSONAL_INFO, PROMPT_PERSONAL_INFO, new FreeTextGrammar(2, 1000, ERR_TEXT_REQUIRED, null));
    }

    @Override
    protected void store(Answers answers, String value) {
        answers.setPersonalInfo(value);
    }
}
