package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.service.flow.input.CsvGrammar;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

@Component
public class ExperienceOverviewStep extends CsvAnswerStep {

    public ExperienceOverviewStep() {
        super(Step.EXPERIENCE_OVERVIEW, PROMPT_EXPERIENCE_OVERVIEW,
                new CsvGrammar(2, 2, ERR_EXPERIENCE_OVERVIEW, EXAMPLE_EXPERIENCE_OVERVIEW));
    }

    @Override
    protected void store(Answers answers, List<String> fields) {
        answers.getCoverLetter().setYearsExperience(fields.get(0));
        answers.getCoverLetter().setIndustries(fields.get(1));
    }
}
