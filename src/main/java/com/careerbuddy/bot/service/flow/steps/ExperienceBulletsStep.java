package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.constant.BotConstants;
import com.careerbuddy.bot.exception.ValidationException;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Experience;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.FreeTextGrammar;
import org.springframework.stereotype.Component;

import static com.careerbuddy.bot.constant.MessageTemplates.*;
import static com.careerbuddy.bot.util.MessageUtils.escapeHtml;

/**
 * Nested loop of the experience section: achievements of the experience added last.
 */
@Component
public class ExperienceBulletsStep implements StepHandler {

    private static final FreeTextGrammar GRAMMAR = new FreeTextGrammar(3, 500, ERR_BULLET, EXAMPLE_BULLET);

    @Override
    public Step step() {
        return Step.EXPERIENCE_BULLETS;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        Experience experience = ctx.getAnswers().lastExperience();
        if (experience == null) {
            return StepResult.moveTo(Step.EXPERIENCE_HEADER);
        }
        return StepResult.stay(String.format(PROMPT_BULLETS, escapeHtml(experience.getRole())));
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        Experience experience = ctx.getAnswers().lastExperience();
        if (experience == null) {
            return StepResult.moveTo(Step.EXPERIENCE_HEADER);
        }
        if (LoopStepHandler.isTerminator(input)) {
            return StepResult.advance();
        }

        String bullet = stripBulletMarker(GRAMMAR.parse(input));
        if (experience.getBullets().size() >= BotConstants.MAX_BULLETS_PER_EXPERIENCE) {
            throw new ValidationException(String.format(ERR_BULLET_LIMIT, experience.getBullets().size()));
        }
        experience.getBullets().add(bullet);

        int count = experience.getBullets().size();
        return StepResult.stay(String.format(BULLET_ADDED, count, count == 1 ? "" : "s"));
    }

    @Override
    public StepResult onSkip(StepContext ctx) {
        return StepResult.advance();
    }

    static String stripBulletMarker(String bullet) {
        String stripped = bullet.replaceFirst("^[•\\-*]+\\s*", "");
        return stripped.isEmpty() ? bullet : stripped;
    }
}
