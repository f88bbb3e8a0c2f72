package com.careerbuddy.bot.service.flow;

import com.careerbuddy.bot.constant.MessageTemplates;
import com.careerbuddy.bot.exception.ValidationException;
import com.careerbuddy.bot.model.Step;

/**
 * Handles one {@link Step}. Implementations are stateless; everything they need comes from the
 * {@link StepContext} and everything they decide goes into the {@link StepResult}. Invalid input is
 * reported by throwing {@link ValidationException}, which leaves the step unchanged.
 */
public interface StepHandler {

    Step step();

    /** Prompt shown when the job arrives at this step. */
    StepResult onEnter(StepContext ctx);

    StepResult handle(StepContext ctx, String input);

    /** A wake word was sent. Re-prompts unless the step has something better to show. */
    default StepResult onWake(StepContext ctx) {
        return onEnter(ctx);
    }

    default StepResult onSkip(StepContext ctx) {
        if (step().isSkippable()) {
            return StepResult.advance();
        }
        throw new ValidationException(MessageTemplates.SKIP_NOT_ALLOWED);
    }
}
