package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.CsvGrammar;

import java.util.List;

/**
 * Single comma separated answer, e.g. "Title, Company".
 */
public abstract class CsvAnswerStep implements StepHandler {

    private final Step step;
    private final String prompt;
    private final CsvGrammar grammar;

    protected CsvAnswerStep(Step step, String prompt, CsvGrammar grammar) {
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

    protected abstract void store(Answers answers, List<String> fields);
}
