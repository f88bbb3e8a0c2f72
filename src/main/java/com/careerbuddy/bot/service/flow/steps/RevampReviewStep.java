package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.constant.BotConstants;
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
import static com.careerbuddy.bot.util.MessageUtils.truncate;

/**
 * Shows an excerpt of the improved resume. "yes" keeps it, any longer text replaces it.
 */
@Component
public class RevampReviewStep implements StepHandler {

    private static final YesNoGrammar YES_NO = new YesNoGrammar();

    private final ContentPort content;

    @Autowired
    public RevampReviewStep(ContentPort content) {
        this.content = content;
    }

    @Override
    public Step step() {
        return Step.REVAMP_REVIEW;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return showRevamp(ctx, true);
    }

    @Override
    public StepResult onWake(StepContext ctx) {
        return showRevamp(ctx, false);
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        Answers answers = ctx.getAnswers();
        if (YES_NO.isYes(input)) {
            if (isBlank(answers.getRevampedContent())) {
                StepResult pending = showRevamp(ctx, false);
                if (isBlank(answers.getRevampedContent())) {
                    return pending;
                }
            }
            return StepResult.advance();
        }

        String own = input == null ? "" : input.trim();
        if (own.length() < BotConstants.MIN_PASTED_RESUME_LENGTH) {
            throw new ValidationException(String.format(ERR_UPLOAD_SHORT, BotConstants.MIN_PASTED_RESUME_LENGTH));
        }
        answers.setRevampedContent(own);
        return StepResult.advance();
    }

    private StepResult showRevamp(StepContext ctx, boolean wait) {
        Answers answers = ctx.getAnswers();
        if (isBlank(answers.getRevampedContent())) {
            Optional<String> revamped = content.revamp(ctx.generationRequest(), wait);
            if (revamped.isEmpty()) {
                return StepResult.stay(String.format(GENERATING, "improved resume"));
            }
            answers.setRevampedContent(revamped.get());
        }
        String excerpt = truncate(answers.getRevampedContent(), BotConstants.PREVIEW_EXCERPT_LENGTH);
        return StepResult.stay(String.format(REVAMP_SHOW, escapeHtml(excerpt)));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
