package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.constant.BotConstants;
import com.careerbuddy.bot.exception.ValidationException;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.service.flow.ContentPort;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.input.CommaListGrammar;
import com.careerbuddy.bot.service.flow.input.NumericSelectionGrammar;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.careerbuddy.bot.constant.MessageTemplates.*;
import static com.careerbuddy.bot.util.MessageUtils.escapeHtml;

/**
 * Offers AI suggested skills for the target role. The user picks some by number or types their own.
 */
@Component
public class SkillsStep implements StepHandler {

    private static final NumericSelectionGrammar SELECTION = new NumericSelectionGrammar(
            BotConstants.MIN_SKILLS, BotConstants.MAX_SELECTED_SKILLS, ERR_SKILLS, EXAMPLE_SKILLS);

    private static final CommaListGrammar CUSTOM = new CommaListGrammar(BotConstants.MIN_SKILLS, 20, ERR_SKILLS, EXAMPLE_SKILLS);

    private final ContentPort content;

    @Autowired
    public SkillsStep(ContentPort content) {
        this.content = content;
    }

    @Override
    public Step step() {
        return Step.SKILLS;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return showSuggestions(ctx, true);
    }

    @Override
    public StepResult onWake(StepContext ctx) {
        return showSuggestions(ctx, false);
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        Answers answers = ctx.getAnswers();
        if (SELECTION.matches(input)) {
            if (answers.getAiSuggestedSkills().isEmpty()) {
                throw new ValidationException(ERR_SKILLS, "Python, SQL, Data Visualization");
            }
            answers.setSkills(new ArrayList<>(SELECTION.parse(input, answers.getAiSuggestedSkills())));
        } else {
            answers.setSkills(new ArrayList<>(CUSTOM.parse(input)));
        }
        return StepResult.advance();
    }

    private StepResult showSuggestions(StepContext ctx, boolean wait) {
        Answers answers = ctx.getAnswers();
        if (answers.getAiSuggestedSkills().isEmpty()) {
            Optional<List<String>> suggested = content.skills(ctx.generationRequest(), wait);
            if (suggested.isEmpty()) {
                return StepResult.stay(String.format(GENERATING, "skill suggestions"));
            }
            answers.setAiSuggestedSkills(new ArrayList<>(suggested.get().stream()
                    .limit(BotConstants.MAX_SUGGESTED_SKILLS)
                    .toList()));
        }
        return StepResult.stay(String.format(SKILLS_SELECTION, numbered(answers.getAiSuggestedSkills())));
    }

    private static String numbered(List<String> skills) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < skills.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(i + 1).append(". ").append(escapeHtml(skills.get(i)));
        }
        return sb.toString();
    }
}
