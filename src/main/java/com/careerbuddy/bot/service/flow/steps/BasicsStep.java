package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.exception.ValidationException;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Basics;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.CsvGrammar;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

@Component
public class BasicsStep implements StepHandler {

    private static final CsvGrammar GRAMMAR = new CsvGrammar(4, 2, ERR_BASICS, EXAMPLE_BASICS);

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    @Override
    public Step step() {
        return Step.BASICS;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return StepResult.stay(PROMPT_BASICS);
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        List<String> fields = GRAMMAR.parse(input);
        if (!EMAIL.matcher(fields.get(1)).matches()) {
            throw new ValidationException(ERR_BASICS, EXAMPLE_BASICS);
        }
        ctx.getAnswers().setBasics(new Basics(fields.get(0), fields.get(1), fields.get(2), fields.get(3)));
        return StepResult.advance();
    }
}
