package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.FreeTextGrammar;
import org.springframework.stereotype.Component;

import static com.careerbuddy.bot.constant.MessageTemplates.*;
import static com.careerbuddy.bot.util.MessageUtils.escapeHtml;

@Component
public class CompanyGoalStep implements StepHandler {

    private static final FreeTextGrammar GRAMMAR = new FreeTextGrammar(3, 1000, ERR_TEXT_REQUIRED, EXAMPLE_COMPANY_GOAL);

    @Override
    public Step step() {
        return Step.COMPANY_GOAL;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        String company = ctx.getAnswers().getCoverLetter().getCompany();
        return StepResult.stay(String.format(PROMPT_COMPANY_GOAL,
                escapeHtml(company == null || company.isBlank() ? "the company" : company)));
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        ctx.getAnswers().getCoverLetter().setCompanyGoal(GRAMMAR.parse(input));
        return StepResult.advance();
    }
}
