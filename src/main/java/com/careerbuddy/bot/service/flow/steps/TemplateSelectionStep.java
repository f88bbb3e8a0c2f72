package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.dto.Menu;
import com.careerbuddy.bot.exception.ValidationException;
import com.careerbuddy.bot.model.DocumentTemplate;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import org.springframework.stereotype.Component;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

/**
 * Premium only; free users go from the preview straight to finalizing with the classic template.
 */
@Component
public class TemplateSelectionStep implements StepHandler {

    @Override
    public Step step() {
        return Step.TEMPLATE_SELECTION;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return StepResult.stay(PROMPT_TEMPLATE, Menu.TEMPLATE_MENU);
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        DocumentTemplate template = DocumentTemplate.fromInput(input)
                .orElseThrow(() -> new ValidationException(ERR_TEMPLATE, EXAMPLE_TEMPLATE));
        ctx.getAnswers().setTemplate(template.getCode());
        return StepResult.advance();
    }
}
