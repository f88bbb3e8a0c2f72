package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.constant.BotConstants;
import com.careerbuddy.bot.exception.ValidationException;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.service.flow.DocumentRequirements;
import com.careerbuddy.bot.service.flow.PreviewFormatter;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.YesNoGrammar;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

@Component
public class PreviewStep implements StepHandler {

    private static final YesNoGrammar YES_NO = new YesNoGrammar();

    @Override
    public Step step() {
        return Step.PREVIEW;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return StepResult.stay(PreviewFormatter.format(ctx.getDocumentType(), ctx.getAnswers()) + PREVIEW_FOOTER);
    }

    /** Wake words ("generate", "proceed", ...) confirm the preview. */
    @Override
    public StepResult onWake(StepContext ctx) {
        return confirm(ctx);
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        if (YES_NO.isYes(input)) {
            return confirm(ctx);
        }
        return StepResult.stay(PREVIEW_CHANGES);
    }

    private StepResult confirm(StepContext ctx) {
        List<String> missing = DocumentRequirements.missingFields(ctx.getDocumentType(), ctx.getAnswers());
        if (!missing.isEmpty()) {
            throw new ValidationException(String.format(ERR_PREVIEW_INCOMPLETE, String.join(", ", missing)));
        }
        if (!ctx.isPremium()) {
            ctx.getAnswers().setTemplate(BotConstants.DEFAULT_TEMPLATE);
        }
        return StepResult.advance();
    }
}
