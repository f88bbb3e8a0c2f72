package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.service.flow.input.CsvGrammar;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

@Component
public class CurrentRoleStep extends CsvAnswerStep {

    public CurrentRoleStep() {
        super(Step.CURRENT_ROLE, PROMPT_CURRENT_ROLE, new CsvGrammar(2, 2, ERR_CURRENT_ROLE, EXAMPLE_CURRENT_ROLE));
    }

    @Override
    protected void store(Answers answers, List<String> fields) {
        answers.getCoverLetter().setCurrentTitle(fields.get(0));
        answers.getCoverLetter().setCurrentEmployer(fields.get(1));
    }
}
