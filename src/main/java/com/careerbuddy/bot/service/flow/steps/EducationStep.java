package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Education;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.CsvGrammar;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

@Component
public class EducationStep extends LoopStepHandler {

    private static final CsvGrammar GRAMMAR = new CsvGrammar(3, 2, ERR_EDUCATION, EXAMPLE_EDUCATION);

    @Override
    public Step step() {
        return Step.EDUCATION;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return StepResult.stay(PROMPT_EDUCATION);
    }

    @Override
    protected void addEntry(StepContext ctx, String input) {
        List<String> fields = GRAMMAR.parse(input);
        ctx.getAnswers().getEducation().add(new Education(fields.get(0), fields.get(1), fields.get(2)));
    }
}
