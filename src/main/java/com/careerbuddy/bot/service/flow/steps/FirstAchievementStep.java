package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.constant.MessageTemplates;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.answers.Answers;
import org.springframework.stereotype.Component;

@Component
public class FirstAchievementStep extends AchievementStep {

    public FirstAchievementStep() {
        super(Step.ACHIEVEMENT_1, MessageTemplates.PROMPT_ACHIEVEMENT_1);
    }

    @Override
    protected void store(Answers answers, String value) {
        answers.getCoverLetter().setAchievement1(value);
    }
}
