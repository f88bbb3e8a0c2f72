package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.constant.BotConstants;
import com.careerbuddy.bot.constant.MessageTemplates;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;

/**
 * Repeatable section: every message adds one entry until the user sends done, no or skip.
 */
public abstract class LoopStepHandler implements StepHandler {

    @Override
    public StepResult handle(StepContext ctx, String input) {
        if (isTerminator(input)) {
            return StepResult.advance();
        }
        addEntry(ctx, input);
        return StepResult.stay(MessageTemplates.ENTRY_ADDED);
    }

    @Override
    public StepResult onSkip(StepContext ctx) {
        return StepResult.advance();
    }

    /** Parses and stores one entry; throws a validation error when it is malformed. */
    protected abstract void addEntry(StepContext ctx, String input);

    static boolean isTerminator(String input) {
        return input != null && BotConstants.LOOP_TERMINATORS.contains(input.trim().toLowerCase());
    }
}
