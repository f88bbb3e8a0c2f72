package com.careerbuddy.bot.service.flow.steps;

import com.careerbuddy.bot.constant.MessageTemplates;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepResult;
import org.springframework.stereotype.Component;

@Component
public class DoneStep implements StepHandler {

    @Override
    public Step step() {
        return Step.DONE;
    }

    @Override
    public StepResult onEnter(StepContext ctx) {
        return StepResult.stay(MessageTemplates.DONE);
    }

    @Override
    public StepResult handle(StepContext ctx, String input) {
        return StepResult.stay(MessageTemplates.DONE);
    }
}
