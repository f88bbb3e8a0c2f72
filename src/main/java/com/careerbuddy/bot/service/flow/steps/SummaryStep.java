package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.exception.ValidationException;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.service.flow.ContentPort;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.YesNoGrammar;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.careerbuddy.bot.constant.MessageTemplates.*;
import static com.careerbuddy.bot.util.MessageUtils.escapeHtml;

@Component
public class SummaryStep implements StepHandler {

    private static final int MIN_OWN_SUMMARY_LENGTH = 15;

    private static final YesNoGrammar YES_NO = new YesNoGrammar();

    private final ContentPort content;

    @Autowired
    public SummaryStep(ContentPort content) {
        this.content = content;
    }

    @Override
    public Step step() {
        return Step.SUMMARY;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return showSummary(ctx, true);
    }

    @Override
    public StepResult onWake(StepContext ctx) {
        return showSummary(ctx, false);
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        Answers answers = ctx.getAnswers();
        if (YES_NO.isYes(input)) {
            if (answers.getAiSummary() == null) {
                StepResult pending = showSummary(ctx, false);
                if (answers.getAiSummary() == null) {
                    return pending;
                }
            }
            answers.setSummary(answers.getAiSummary());
            return StepResult.advance();
        }

        String own = input == null ? "" : input.trim();
        if (own.length() < MIN_OWN_SUMMARY_LENGTH) {
            throw new ValidationException(ERR_SUMMARY_SHORT, EXAMPLE_SUMMARY);
        }
        answers.setSummary(own);
        return StepResult.advance();
    }

    private StepResult showSummary(StepContext ctx, boolean wait) {
        Answers answers = ctx.getAnswers();
        if (answers.getAiSummary() == null) {
            Optional<String> generated = content.summary(ctx.generationRequest(), wait);
            if (generated.isEmpty()) {
                return StepResult.stay(String.format(GENERATING, "professional summary"));
            }
            answers.setAiSummary(generated.get());
        }
        return StepResult.stay(String.format(SUMMARY_SHOW, escapeHtml(answers.getAiSummary())));
    }
}
