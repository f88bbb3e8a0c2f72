package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Experience;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.CsvGrammar;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

@Component
public class ExperienceHeaderStep implements StepHandler {

    private static final CsvGrammar GRAMMAR = new CsvGrammar(5, 2, ERR_EXPERIENCE_HEADER, EXAMPLE_EXPERIENCE_HEADER);

    @Override
    public Step step() {
        return Step.EXPERIENCE_HEADER;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return StepResult.stay(PROMPT_EXPERIENCE_HEADER);
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        List<String> fields = GRAMMAR.parse(input);
        ctx.getAnswers().getExperiences()
                .add(new Experience(fields.get(0), fields.get(1), fields.get(2), fields.get(3), fields.get(4)));
        return StepResult.advance();
    }

    /** No (more) experience: the bullet and add-another steps are left out. */
    @Override
    public StepResult onSkip(StepContext ctx) {
        return StepResult.moveTo(Step.EDUCATION);
    }
}
