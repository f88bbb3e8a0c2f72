package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.CommaListGrammar;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

@Component
public class KeySkillsStep implements StepHandler {

    private static final CommaListGrammar GRAMMAR = new CommaListGrammar(3, 5, ERR_KEY_SKILLS, EXAMPLE_KEY_SKILLS);

    @Override
    public Step step() {
        return Step.KEY_SKILLS;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return StepResult.stay(PROMPT_KEY_SKILLS);
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        ctx.getAnswers().getCoverLetter().setKeySkills(new ArrayList<>(GRAMMAR.parse(input)));
        return StepResult.advance();
    }
}
