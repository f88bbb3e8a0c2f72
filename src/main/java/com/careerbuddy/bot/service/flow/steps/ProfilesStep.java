package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.exception.ValidationException;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Profile;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.CsvGrammar;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

@Component
public class ProfilesStep extends LoopStepHandler {

    private static final CsvGrammar GRAMMAR = new CsvGrammar(2, 2, ERR_PROFILES, EXAMPLE_PROFILE);

    @Override
    public Step step() {
        return Step.PROFILES;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return StepResult.stay(PROMPT_PROFILES);
    }

    @Override
    protected void addEntry(StepContext ctx, String input) {
        List<String> fields = GRAMMAR.parse(input);
        String url = fields.get(1);
        if (url.contains(" ") || !url.contains(".")) {
            throw new ValidationException(ERR_PROFILES, EXAMPLE_PROFILE);
        }
        ctx.getAnswers().getProfiles().add(new Profile(fields.get(0), url));
    }
}
