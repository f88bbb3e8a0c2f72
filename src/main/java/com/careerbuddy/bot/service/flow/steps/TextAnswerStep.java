package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.FreeTextGrammar;

/**
 * Single free text answer stored into one field.
 */
public abstract class TextAnswerStep implements StepHandler {

    private final Step step;
    private final String prompt;
    private final FreeTextGrammar grammar;

    protected TextAnswerStep(Step step, String prompt, FreeTextGrammar grammar) {
        this.step = step;
        this.prompt = prompt;
        this.grammar = grammar;
    }

    @Override
    public Step step() {
        return step;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return StepResult.stay(prompt);
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        store(ctx.getAnswers(), grammar.parse(input));
        return StepResult.advance();
    }

    protected abstract void store(Answers answers, String value);
}
