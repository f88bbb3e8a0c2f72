package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.constant.MessageTemplates;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Answers;
import org.springframework.stereotype.Component;

/** Optional; skipping leaves the letter with a single achievement. */
@Component
public class SecondAchievementStep extends AchievementStep {

    public SecondAchievementStep() {
        super(Step.ACHIEVEMENT_2, MessageTemplates.PROMPT_ACHIEVEMENT_2);
    }

    @Override
    protected void store(Answers answers, String value) {
        answers.getCoverLetter().setAchievement2(value);
    }
}
