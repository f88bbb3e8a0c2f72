package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.FreeTextGrammar;
import org.springframework.stereotype.Component;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

@Component
public class CertificationsStep extends LoopStepHandler {

    private static final FreeTextGrammar GRAMMAR = new FreeTextGrammar(2, 300, ERR_ENTRY_EMPTY, EXAMPLE_CERTIFICATION);

    @Override
    public Step step() {
        return Step.CERTIFICATIONS;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return StepResult.stay(PROMPT_CERTIFICATIONS);
    }

    @Override
    protected void addEntry(StepContext ctx, String input) {
        ctx.getAnswers().getCertifications().add(GRAMMAR.parse(input));
    }
}
