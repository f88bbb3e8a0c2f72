package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.service.flow.input.CsvGrammar;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

@Component
public class RoleCompanyStep extends CsvAnswerStep {

    public RoleCompanyStep() {
        super(Step.ROLE_COMPANY, PROMPT_ROLE_COMPANY, new CsvGrammar(2, 2, ERR_ROLE_COMPANY, EXAMPLE_ROLE_COMPANY));
    }

    @Override
    protected void store(Answers answers, List<String> fields) {
        answers.getCoverLetter().setRole(fields.get(0));
        answers.getCoverLetter().setCompany(fields.get(1));
        answers.setTargetRole(fields.get(0));
    }
}
