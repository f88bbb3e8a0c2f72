package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.YesNoGrammar;
import org.springframework.stereotype.Component;

import static com.careerbuddy.bot.constant.MessageTemplates.PROMPT_FINALIZE;

/**
 * Generation happens on arrival. The step is only revisited after a denial, where the user can
 * retry, or reply "pay" for a one-off purchase.
 */
@Component
public class FinalizeStep implements StepHandler {

    static final String PAY = "pay";

    private static final YesNoGrammar YES_NO = new YesNoGrammar();

    @Override
    public Step step() {
        return Step.FINALIZE;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return StepResult.finalizeJob();
    }

    @Override
    public StepResult onWake(StepContext ctx) {
        return StepResult.finalizeJob();
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        String normalized = input == null ? "" : input.trim().toLowerCase();
        if (PAY.equals(normalized) || "/pay".equals(normalized)) {
            return StepResult.requestPayment();
        }
        if (YES_NO.isYes(normalized)) {
            return StepResult.finalizeJob();
        }
        return StepResult.stay(PROMPT_FINALIZE);
    }
}
